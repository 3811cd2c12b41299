package com.largomodo.shelfpack;

import com.largomodo.shelfpack.core.domain.Bin;
import com.largomodo.shelfpack.core.domain.BinRequest;
import com.largomodo.shelfpack.core.domain.ShelfPacker;
import com.largomodo.shelfpack.util.BinSpecParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for packing rectangles onto a single surface.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation
 * and type-safe validation. Bins come from positional {@code WxH} / {@code ID=WxH}
 * arguments, from an input file, or both (arguments first, then file lines).
 * <p>
 * Placements are written to standard output in request order so the result can
 * be piped into an atlas builder; diagnostics go through the logger.
 */
@Command(
        name = "shelfpack",
        mixinStandardHelpOptions = true,
        resourceBundle = "shelfpack.shelfpack",
        version = "${bundle:application.version}",
        header = "Packs rectangles onto a single surface using Shelf Best-Height-Fit.",
        description = {
                "Places each requested bin on the shelf whose height wastes the least space,",
                "opening new shelves below existing ones and optionally growing the surface.",
                "",
                "Output is one line per bin: 'ID X Y W H', with '-' coordinates for bins that",
                "could not be placed, followed by the final surface size."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:All bins placed",
                "1:General execution error (I/O, etc.)",
                "2:Invalid command line arguments",
                "3:One or more bins could not be placed"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class ShelfPack implements Callable<Integer> {

    static final int EXIT_UNPLACED = 3;

    private static final Logger log = LoggerFactory.getLogger(ShelfPack.class);

    @Parameters(paramLabel = "BIN", arity = "0..*", converter = BinSpecConverter.class,
            description = {
                    "Bin to pack, as WxH or ID=WxH (e.g. 12x16, 7=12x16).",
                    "Bins without an ID are numbered automatically."
            })
    List<BinRequest> bins = new ArrayList<>();

    @Option(names = {"-i", "--input"}, paramLabel = "FILE",
            description = {
                    "File with one bin spec per line.",
                    "Blank lines and lines starting with '#' are ignored."
            })
    File inputFile;

    @Option(names = "--width", defaultValue = "" + ShelfPacker.DEFAULT_SIZE,
            description = "Initial surface width (default: ${DEFAULT-VALUE})")
    int width;

    @Option(names = "--height", defaultValue = "" + ShelfPacker.DEFAULT_SIZE,
            description = "Initial surface height (default: ${DEFAULT-VALUE})")
    int height;

    @Option(names = {"-a", "--auto-resize"},
            description = "Grow the surface when a bin does not fit")
    boolean autoResize;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ShelfPack()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (width <= 0 || height <= 0) {
            throw new ParameterException(spec.commandLine(),
                    "Surface size must be positive, got: " + width + "x" + height);
        }

        List<BinRequest> requests = collectRequests();
        if (requests.isEmpty()) {
            throw new ParameterException(spec.commandLine(),
                    "No bins to pack: pass WxH arguments or --input FILE");
        }

        ShelfPacker packer = new ShelfPacker(width, height, autoResize);
        List<Bin> placed = packer.pack(requests, true);

        PrintWriter out = spec.commandLine().getOut();
        for (BinRequest request : requests) {
            String id = request.getId().isPresent() ? String.valueOf(request.getId().getAsInt()) : "?";
            if (request.isPlaced()) {
                out.printf("%s %d %d %d %d%n", id, request.getX(), request.getY(), request.getW(), request.getH());
            } else {
                log.warn("Bin {} ({}x{}) could not be placed", id, request.getW(), request.getH());
                out.printf("%s - - %d %d%n", id, request.getW(), request.getH());
            }
        }
        out.printf("size %dx%d%n", packer.getWidth(), packer.getHeight());
        out.flush();

        log.debug("Allocations per height: {}", packer.getHeightStats());
        log.info("Packed {} of {} bins into {}x{} ({} shelves)",
                placed.size(), requests.size(), packer.getWidth(), packer.getHeight(), packer.getShelfCount());

        return placed.size() == requests.size() ? 0 : EXIT_UNPLACED;
    }

    private List<BinRequest> collectRequests() throws IOException {
        List<BinRequest> requests = new ArrayList<>(bins);
        if (inputFile != null) {
            if (!inputFile.isFile()) {
                throw new ParameterException(spec.commandLine(),
                        "Input file does not exist: " + inputFile.getAbsolutePath());
            }
            try {
                requests.addAll(BinSpecParser.parseFile(inputFile.toPath()));
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), e.getMessage(), e);
            }
        }
        return requests;
    }

    /**
     * Adapts {@link BinSpecParser} to Picocli so bad specs are reported as usage errors.
     */
    static class BinSpecConverter implements ITypeConverter<BinRequest> {
        @Override
        public BinRequest convert(String value) {
            try {
                return BinSpecParser.parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }
}
