package modelicafmt;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.antlr.v4.runtime.tree.ParseTreeWalker;

/**
 * Formats Modelica source files.
 *
 * Usage: java -jar modelica-fmt.jar [-w] [-indent-parens] [-config file] [-v] file-or-directory...
 */
public class ModelicaFmt {

    private final FormatterConfiguration config;

    public ModelicaFmt(FormatterConfiguration config) {
        this.config = config;
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        FormatterConfiguration config = new FormatterConfiguration();
        config.loadDefaults();

        List<String> inputs = new ArrayList<>();
        Path configFile = null;
        Boolean overwrite = null;
        Boolean indentParens = null;
        Boolean verbose = null;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-w":
                    overwrite = true;
                    break;
                case "-indent-parens":
                    indentParens = true;
                    break;
                case "-v":
                    verbose = true;
                    break;
                case "-config":
                    if (i + 1 >= args.length) {
                        printUsage(err);
                        return 1;
                    }
                    configFile = Paths.get(args[++i]);
                    break;
                case "-h":
                case "-help":
                    printUsage(out);
                    return 0;
                default:
                    if (arg.startsWith("-")) {
                        err.println("Unknown option: " + arg);
                        printUsage(err);
                        return 1;
                    }
                    inputs.add(arg);
            }
        }

        if (inputs.isEmpty()) {
            printUsage(err);
            return 1;
        }

        if (configFile != null) {
            try {
                config.load(configFile);
            } catch (IOException e) {
                err.println("Error reading configuration " + configFile + ": " + e.getMessage());
                return 1;
            }
        }

        // command line flags win over the configuration file
        if (overwrite != null) {
            config.setOverwrite(overwrite);
        }
        if (indentParens != null) {
            config.setAlwaysIndentParens(indentParens);
        }
        if (verbose != null) {
            config.setVerboseLogging(verbose);
        }

        List<String> issues = config.validate();
        if (!issues.isEmpty()) {
            err.println("Configuration issues:");
            issues.forEach(issue -> err.println("  - " + issue));
            return 1;
        }

        if (config.isVerboseLogging()) {
            err.println("Using " + config);
        }

        ModelicaFmt fmt = new ModelicaFmt(config);
        int status = 0;
        for (String input : inputs) {
            List<Path> files;
            try {
                files = fmt.collectFiles(Paths.get(input));
            } catch (IOException e) {
                err.println("Error listing " + input + ": " + e.getMessage());
                status = 1;
                continue;
            }

            for (Path file : files) {
                try {
                    fmt.processFile(file, out, err);
                } catch (IOException | ModelicaSyntaxException | IllegalStateException e) {
                    err.println("Error formatting " + file + ": " + e.getMessage());
                    status = 1;
                }
            }
        }
        return status;
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: java -jar modelica-fmt.jar [options] <file-or-directory>...");
        stream.println("Options:");
        stream.println("  -w               overwrite the source files with the formatted output");
        stream.println("  -indent-parens   always indent the arguments of parenthesized calls");
        stream.println("  -config <file>   load settings from a properties file");
        stream.println("  -v               verbose progress on standard error");
        stream.println("Examples:");
        stream.println("  java -jar modelica-fmt.jar MyModel.mo");
        stream.println("  java -jar modelica-fmt.jar -w Buildings/");
    }

    /**
     * Returns the file itself, or every file with the configured extension
     * below a directory, sorted by path.
     */
    List<Path> collectFiles(Path input) throws IOException {
        if (!Files.exists(input)) {
            throw new IOException("No such file or directory: " + input);
        }
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        String suffix = "." + config.getFileExtension();
        try (Stream<Path> walk = Files.walk(input)) {
            return walk.filter(Files::isRegularFile)
                       .filter(path -> path.getFileName().toString().endsWith(suffix))
                       .sorted()
                       .collect(Collectors.toList());
        }
    }

    void processFile(Path file, PrintStream out, PrintStream err) throws IOException {
        if (config.isVerboseLogging()) {
            err.println("Formatting " + file);
        }

        String original = Files.readString(file, config.getCharset());
        String formatted = format(original, file.toString());

        if (!config.isOverwrite()) {
            out.print(formatted);
            out.flush();
        } else if (!formatted.equals(original)) {
            Files.writeString(file, formatted, config.getCharset());
            if (config.isVerboseLogging()) {
                err.println("Rewrote " + file);
            }
        } else if (config.isVerboseLogging()) {
            err.println("Unchanged " + file);
        }
    }

    public String formatFile(Path file) throws IOException {
        return format(Files.readString(file, config.getCharset()), file.toString());
    }

    public String format(String source) {
        return format(source, "<input>");
    }

    /**
     * Formats one unit of Modelica source.
     *
     * @throws ModelicaSyntaxException if the source does not parse
     */
    public String format(String source, String sourceName) {
        StringWriter buffer = new StringWriter();
        formatTo(ModelicaSource.parse(source, sourceName), buffer);
        return buffer.toString();
    }

    /**
     * Reads the whole of {@code in} and writes the formatted text to {@code out}.
     * Nothing is written to {@code out} unless formatting succeeds.
     */
    public void format(Reader in, Writer out) throws IOException {
        StringBuilder source = new StringBuilder();
        char[] chunk = new char[8192];
        int read;
        while ((read = in.read(chunk)) != -1) {
            source.append(chunk, 0, read);
        }
        String formatted = format(source.toString());
        out.write(formatted);
        out.flush();
    }

    private void formatTo(ModelicaSource source, Writer buffer) {
        ModelicaFormatter formatter = new ModelicaFormatter(buffer, source.getCommentTokens(), config);
        try {
            ParseTreeWalker.DEFAULT.walk(formatter, source.getTree());
            formatter.close();
        } catch (UncheckedIOException e) {
            // only in-memory buffers are written during the walk
            throw new IllegalStateException("Unexpected I/O failure while formatting " + source.getSourceName(), e);
        }
    }
}
