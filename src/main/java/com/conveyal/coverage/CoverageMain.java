package com.conveyal.coverage;

import com.conveyal.coverage.components.Components;
import com.conveyal.coverage.components.LocalComponents;
import com.conveyal.coverage.fetch.CoverageRequest;
import com.conveyal.coverage.fetch.SubsetParser;
import com.conveyal.coverage.jobs.JobDefinition;
import com.conveyal.coverage.jobs.JobStatus;
import com.conveyal.coverage.process.ProcessDefinition;
import com.conveyal.coverage.process.ProcessDocument;
import com.conveyal.coverage.util.ExceptionUtils;
import com.conveyal.coverage.util.JsonUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Command line entry point: optionally registers a process definition from a JSON file, then optionally runs one
 * invocation of a process through the local job runner, waits for it and prints the resulting job status.
 */
public abstract class CoverageMain {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageMain.class);

    private static final Duration MAX_WAIT = Duration.ofHours(1);

    private static final Options options = new Options();

    static {
        options.addOption("c", "config", true, "Configuration properties file (default coverage.properties).");
        options.addOption("r", "register", true, "Register the process definition in this JSON file.");
        options.addOption("p", "process", true, "Id of the process to run.");
        options.addOption("C", "collections", true, "Comma separated source collection ids.");
        options.addOption("s", "subset", true, "Subset, e.g. lon(16:16.1),lat(48:48.1),time(\"2020-09-10\").");
        options.addOption("b", "range-subset", true, "Comma separated output bands to include.");
        options.addOption("f", "format", true, "Output format (default GeoTIFF).");
        options.addOption("W", "width", true, "Output width in pixels.");
        options.addOption("H", "height", true, "Output height in pixels.");
        options.addOption("h", "help", false, "Print this message.");
    }

    public static void main (String... args) {
        System.exit(execute(args));
    }

    public static int execute (String... args) {
        CommandLine commandLine;
        try {
            commandLine = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            System.err.println(e.getMessage());
            new HelpFormatter().printHelp("coverage-processor", options);
            return 2;
        }
        if (commandLine.hasOption("h") || !(commandLine.hasOption("r") || commandLine.hasOption("p"))) {
            new HelpFormatter().printHelp("coverage-processor", options);
            return commandLine.hasOption("h") ? 0 : 2;
        }
        // Bad option values are usage errors, reported before any component starts.
        JobDefinition jobDefinition = null;
        if (commandLine.hasOption("p")) {
            try {
                jobDefinition = jobDefinition(commandLine);
            } catch (IllegalArgumentException e) {
                System.err.println(e.getMessage());
                new HelpFormatter().printHelp("coverage-processor", options);
                return 2;
            }
        }
        CoverageConfig config = CoverageConfig.fromFile(
                commandLine.getOptionValue("c", CoverageConfig.DEFAULT_CONFIG_FILE));
        Components components = new LocalComponents(config);
        try {
            if (commandLine.hasOption("r")) {
                register(components, commandLine.getOptionValue("r"));
            }
            if (jobDefinition != null) {
                return run(components, jobDefinition);
            }
            return 0;
        } catch (CoverageProcessException e) {
            LOG.error("{}", e.toString());
            return 1;
        } catch (Exception e) {
            LOG.error("Unexpected failure:\n{}", ExceptionUtils.stackTraceString(e));
            return 1;
        } finally {
            components.shutdown();
        }
    }

    private static void register (Components components, String filename) throws Exception {
        try (InputStream inputStream = new FileInputStream(filename)) {
            ProcessDefinition definition = components.registry.register(ProcessDocument.fromJson(inputStream));
            LOG.info("Registered process {}. Evaluation order is {}.", definition.id, definition.evaluationOrder());
        }
    }

    /** Build the job from the command line, throwing IllegalArgumentException for missing or malformed values. */
    static JobDefinition jobDefinition (CommandLine commandLine) {
        if (!commandLine.hasOption("s")) {
            throw new IllegalArgumentException("Running a process requires a subset (-s).");
        }
        SubsetParser.Subset subset = SubsetParser.parse(commandLine.getOptionValue("s"));
        CoverageRequest.Builder builder = CoverageRequest.builder()
                .subset(subset.envelope.getMinX(), subset.envelope.getMinY(),
                        subset.envelope.getMaxX(), subset.envelope.getMaxY())
                .temporal(subset.temporal);
        if (commandLine.hasOption("C")) {
            builder.collections(splitList(commandLine.getOptionValue("C")));
        }
        if (commandLine.hasOption("W") || commandLine.hasOption("H")) {
            checkArgument(commandLine.hasOption("W") && commandLine.hasOption("H"),
                    "Output width (-W) and height (-H) must be given together.");
            // NumberFormatException is an IllegalArgumentException.
            builder.size(Integer.parseInt(commandLine.getOptionValue("W")),
                         Integer.parseInt(commandLine.getOptionValue("H")));
        }
        return new JobDefinition(
                commandLine.getOptionValue("p"),
                builder.build(),
                SubsetParser.parseRangeSubset(commandLine.getOptionValue("b")),
                commandLine.getOptionValue("f", "GeoTIFF")
        );
    }

    private static int run (Components components, JobDefinition jobDefinition) throws Exception {
        String jobId = components.jobRunner.submit(jobDefinition);
        JobStatus status = components.jobRunner.awaitCompletion(jobId, MAX_WAIT);
        System.out.println(JsonUtil.objectMapper.writeValueAsString(status));
        return status.status == JobStatus.Status.SUCCESSFUL ? 0 : 1;
    }

    private static List<String> splitList (String text) {
        return Arrays.asList(text.trim().split("\\s*,\\s*"));
    }

}
