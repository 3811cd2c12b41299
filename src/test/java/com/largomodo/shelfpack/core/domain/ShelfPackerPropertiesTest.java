package com.largomodo.shelfpack.core.domain;

import com.largomodo.shelfpack.core.domain.generators.BinSizeGenerator;
import com.largomodo.shelfpack.core.domain.generators.BinSizeGenerator.BinSize;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ShelfPackerPropertiesTest {

    private static final int SURFACE = 256;

    @Property
    void placementsStayInsideFixedSurface(@ForAll("smallBins") List<BinSize> sizes) {
        ShelfPacker packer = new ShelfPacker(SURFACE, SURFACE);

        for (Bin bin : packer.pack(BinSizeGenerator.requests(sizes))) {
            assertTrue(bin.x() >= 0 && bin.y() >= 0, "Negative coordinates: " + bin);
            assertTrue(bin.x() + bin.w() <= SURFACE, "Bin exceeds surface width: " + bin);
            assertTrue(bin.y() + bin.h() <= SURFACE, "Bin exceeds surface height: " + bin);
        }
    }

    @Property
    void placementsNeverOverlap(@ForAll("smallBins") List<BinSize> sizes) {
        ShelfPacker packer = new ShelfPacker(SURFACE, SURFACE);
        List<Bin> bins = packer.pack(BinSizeGenerator.requests(sizes));

        for (int i = 0; i < bins.size(); i++) {
            for (int j = i + 1; j < bins.size(); j++) {
                assertFalse(overlaps(bins.get(i), bins.get(j)),
                        "Overlap between " + bins.get(i) + " and " + bins.get(j));
            }
        }
    }

    @Property
    void collidingIdsNeverShareSpace(@ForAll("smallBins") List<BinSize> sizes,
                                     @ForAll @IntRange(min = 1, max = 4) int idRange) {
        ShelfPacker packer = new ShelfPacker(SURFACE, SURFACE);
        List<BinRequest> requests = BinSizeGenerator.mixedIdRequests(sizes, idRange);

        List<Bin> bins = packer.pack(requests, true);

        for (int i = 0; i < bins.size(); i++) {
            for (int j = i + 1; j < bins.size(); j++) {
                assertFalse(overlaps(bins.get(i), bins.get(j)),
                        "Overlap between " + bins.get(i) + " and " + bins.get(j));
            }
        }
        for (BinRequest request : requests) {
            if (request.isPlaced()) {
                assertTrue(bins.contains(new Bin(request.getId().getAsInt(), request.getW(), request.getH(),
                        request.getX(), request.getY())), "Request written back with a foreign placement: " + request);
            }
        }
    }

    @Property
    void shelfPlacementsAreContiguousLeftToRight(@ForAll("smallBins") List<BinSize> sizes) {
        ShelfPacker packer = new ShelfPacker(SURFACE, SURFACE);
        Map<Integer, Integer> usedWidthByShelfY = new HashMap<>();

        // Every shelf has a distinct y, so y identifies the shelf
        for (Bin bin : packer.pack(BinSizeGenerator.requests(sizes))) {
            int usedBefore = usedWidthByShelfY.getOrDefault(bin.y(), 0);
            assertEquals(usedBefore, bin.x(), "Bin must start where the shelf's used width ends: " + bin);
            usedWidthByShelfY.put(bin.y(), usedBefore + bin.w());
        }
    }

    @Property
    void autoResizeAlwaysPlacesAndNeverShrinksPerRequest(@ForAll("largeBins") List<BinSize> sizes) {
        ShelfPacker packer = new ShelfPacker(16, 16, true);

        for (BinSize size : sizes) {
            int widthBefore = packer.getWidth();
            int heightBefore = packer.getHeight();

            Optional<Bin> bin = packer.packOne(size.w(), size.h());

            assertTrue(bin.isPresent(), "Auto-resize must place " + size);
            assertTrue(packer.getWidth() >= widthBefore, "Width shrank during growth");
            assertTrue(packer.getHeight() >= heightBefore, "Height shrank during growth");
            assertTrue(packer.getWidth() >= size.w());
            assertTrue(packer.getHeight() >= size.h());
            assertTrue(bin.get().x() + size.w() <= packer.getWidth());
            assertTrue(bin.get().y() + size.h() <= packer.getHeight());
        }
    }

    @Property
    void batchShrinkStillBoundsEveryPlacement(@ForAll("largeBins") List<BinSize> sizes) {
        ShelfPacker packer = new ShelfPacker(16, 16, true);

        List<Bin> bins = packer.pack(BinSizeGenerator.requests(sizes));

        assertEquals(sizes.size(), bins.size());
        for (Bin bin : bins) {
            assertTrue(bin.x() + bin.w() <= packer.getWidth(), "Bin outside shrunk width: " + bin);
            assertTrue(bin.y() + bin.h() <= packer.getHeight(), "Bin outside shrunk height: " + bin);
        }
    }

    @Property
    void clearBehavesLikeFreshPacker(@ForAll("smallBins") List<BinSize> warmup,
                                     @ForAll("smallBins") List<BinSize> sizes) {
        ShelfPacker reused = new ShelfPacker(SURFACE, SURFACE);
        reused.pack(BinSizeGenerator.requests(warmup));
        reused.clear();

        ShelfPacker fresh = new ShelfPacker(SURFACE, SURFACE);

        assertEquals(fresh.pack(BinSizeGenerator.requests(sizes)),
                reused.pack(BinSizeGenerator.requests(sizes)));
    }

    @Property
    void rejectedResizeLeavesPackingUnchanged(@ForAll("smallBins") List<BinSize> sizes,
                                              @ForAll @IntRange(min = 1, max = SURFACE - 1) int smaller) {
        ShelfPacker control = new ShelfPacker(SURFACE, SURFACE);
        ShelfPacker resized = new ShelfPacker(SURFACE, SURFACE);
        control.pack(BinSizeGenerator.requests(sizes));
        resized.pack(BinSizeGenerator.requests(sizes));

        assertFalse(resized.resize(smaller, SURFACE * 2));
        assertFalse(resized.resize(SURFACE * 2, smaller));

        assertEquals(SURFACE, resized.getWidth());
        assertEquals(SURFACE, resized.getHeight());
        assertEquals(control.packOne(-1, 8, 8), resized.packOne(-1, 8, 8));
    }

    @Provide
    Arbitrary<List<BinSize>> smallBins() {
        return BinSizeGenerator.sizes(32, 60);
    }

    @Provide
    Arbitrary<List<BinSize>> largeBins() {
        return BinSizeGenerator.sizes(200, 30);
    }

    private static boolean overlaps(Bin a, Bin b) {
        return a.x() < b.x() + b.w() && b.x() < a.x() + a.w()
                && a.y() < b.y() + b.h() && b.y() < a.y() + a.h();
    }
}
