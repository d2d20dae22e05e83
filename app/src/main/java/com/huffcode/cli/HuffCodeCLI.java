package com.huffcode.cli;

import com.huffcode.config.AppConfig;
import com.huffcode.core.EncodedOutput;
import com.huffcode.core.HuffmanCode;
import com.huffcode.error.HuffmanException;
import com.huffcode.service.EncodingService;
import com.huffcode.service.ServiceFactory;
import com.huffcode.session.EncodingSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command-line interface for HuffCode.
 *
 * Usage:
 *   Encode text: java -jar huffcode.jar [-v] <text>
 *   Encode file: java -jar huffcode.jar [-v] -f <input-file>
 */
public class HuffCodeCLI {

    private static final Logger logger = LoggerFactory.getLogger(HuffCodeCLI.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILURE = 2;

    private final EncodingService service;

    public HuffCodeCLI(EncodingService service) {
        this.service = service;
    }

    public static void main(String[] args) {
        int status;
        try {
            status = new HuffCodeCLI(ServiceFactory.createEncodingService(new AppConfig()))
                .run(args, System.out, System.err);
        } catch (RuntimeException e) {
            logger.debug("Startup failed", e);
            System.err.println("Error: " + e.getMessage());
            status = EXIT_FAILURE;
        }
        System.exit(status);
    }

    /**
     * Run one invocation.
     *
     * @return Process exit status
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        boolean verbose = false;
        String text = null;
        Path inputFile = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-v":
                case "--verbose":
                    verbose = true;
                    break;
                case "-f":
                case "--file":
                    if (i + 1 >= args.length) {
                        err.println("Error: missing file name after " + arg);
                        return EXIT_USAGE;
                    }
                    inputFile = Paths.get(args[++i]);
                    break;
                case "-h":
                case "--help":
                    printUsage(out);
                    return EXIT_OK;
                default:
                    if (text != null) {
                        err.println("Error: unexpected argument: " + arg);
                        return EXIT_USAGE;
                    }
                    text = arg;
            }
        }

        if ((text == null) == (inputFile == null)) {
            err.println("Error: provide either the text to encode or -f <file>");
            printUsage(err);
            return EXIT_USAGE;
        }

        byte[] data;
        try {
            data = inputFile != null ? Files.readAllBytes(inputFile) : text.getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Cannot read input {}", inputFile, e);
            err.println("Error: cannot read " + inputFile + ": " + e.getMessage());
            return EXIT_FAILURE;
        }

        EncodingSession session = service.createSession();
        try {
            EncodedOutput output = service.encode(session, data);
            if (verbose) {
                printCodeTable(session, err);
            }
            out.println(output.getBits());
            return EXIT_OK;
        } catch (HuffmanException e) {
            logger.debug("Encoding failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } finally {
            service.resetOrDestroy(session);
        }
    }

    private static void printCodeTable(EncodingSession session, PrintStream err) {
        err.println("Code table (" + session.getCodeTable().size() + " symbols, "
            + session.getNodeCount() + " tree nodes):");
        for (HuffmanCode code : session.getCodeTable().getCodes()) {
            err.println(String.format(Locale.ROOT, "  0x%02x %-6s x%-8d %s",
                code.getSymbol(),
                describe(code.getSymbol()),
                session.getFrequencies().getCount(code.getSymbol()),
                code.getBits()));
        }
        err.println(String.format(Locale.ROOT, "  %.3f bits/symbol", session.getOutput().getBitsPerSymbol()));
    }

    private static String describe(int symbol) {
        if (symbol >= 0x21 && symbol < 0x7f) {
            return "'" + (char) symbol + "'";
        }
        return "";
    }

    private static void printUsage(PrintStream out) {
        out.println("HuffCode - Huffman bit-string encoder");
        out.println();
        out.println("Usage:");
        out.println("  java -jar huffcode.jar [-v] <text>");
        out.println("  java -jar huffcode.jar [-v] -f <input-file>");
        out.println();
        out.println("Options:");
        out.println("  -f, --file     read the input bytes from a file");
        out.println("  -v, --verbose  print the code table to stderr");
        out.println();
        out.println("Example:");
        out.println("  java -jar huffcode.jar abcaabbaaaccaaaa");
    }
}
