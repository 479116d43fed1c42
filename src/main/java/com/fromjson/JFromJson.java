package com.fromjson;

import com.fromjson.convert.ConvertOptions;
import com.fromjson.convert.JsonConverter;
import com.fromjson.json.ConvertFromJsonException;
import com.fromjson.output.OutputFormatter;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(name = "jfromjson", mixinStandardHelpOptions = true, versionProvider = JFromJson.class,
         description = "Convert JSON text into objects and print each resulting item")
public class JFromJson implements Callable<Integer>, IVersionProvider {
    static final int EXIT_IO_ERROR = 4;

    private static final Logger logger = LoggerFactory.getLogger(JFromJson.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", description = "Input JSON files, read line by line (default: stdin)")
    private List<File> inputFiles;

    @Option(names = {"-A", "--as-hashtable"}, description = "Convert objects to ordered maps instead of records")
    private boolean asHashtable = false;

    @Option(names = {"-N", "--no-enumerate"}, description = "Keep a top-level array as a single output item")
    private boolean noEnumerate = false;

    @Option(names = {"-d", "--depth"}, defaultValue = "1024",
            description = "Maximum nesting depth of objects and arrays (1-2048, default: ${DEFAULT-VALUE})")
    private int depth;

    @Option(names = {"-c", "--compress"}, description = "Print each item without whitespace")
    private boolean compress = false;

    private InputStream stdin = System.in;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new JFromJson()).execute(args);
        System.exit(exitCode);
    }

    void setStdin(InputStream stdin) {
        this.stdin = stdin;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ConvertOptions options = new ConvertOptions(asHashtable, noEnumerate, depth);
            MutableList<Object> results = new JsonConverter().convert(readChunks(), options);

            OutputFormatter formatter = new OutputFormatter(!compress);
            results.each(result -> out.println(formatter.format(result)));
            out.flush();
            return 0;
        } catch (ConvertFromJsonException e) {
            logger.debug("Conversion failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return e.kind().exitCode();
        } catch (IOException e) {
            logger.debug("Reading input failed", e);
            err.println("Error: " + e.getMessage());
            err.flush();
            return EXIT_IO_ERROR;
        }
    }

    private List<String> readChunks() throws IOException {
        if (inputFiles == null || inputFiles.isEmpty()) {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdin, StandardCharsets.UTF_8))) {
                return reader.lines().collect(Collectors.toList());
            }
        }
        MutableList<String> chunks = Lists.mutable.empty();
        for (File file : inputFiles) {
            chunks.addAll(Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
        }
        return chunks;
    }

    @Override
    public String[] getVersion() {
        var pkg = JFromJson.class.getPackage();
        var ver = pkg == null ? null : pkg.getImplementationVersion();
        return new String[] {
            "${COMMAND-FULL-NAME} " + Objects.requireNonNullElse(ver, "<unknown version>")
        };
    }
}
