package ai.punctuation.keeper.cli;

import ai.punctuation.keeper.config.Config;
import ai.punctuation.keeper.config.ConfigLoader;
import ai.punctuation.keeper.config.ProcessorConfig;
import ai.punctuation.keeper.config.SystemEnvironmentReader;
import ai.punctuation.keeper.document.DocumentReader;
import ai.punctuation.keeper.document.DocumentWriter;
import ai.punctuation.keeper.logging.LoggingConfigurator;
import ai.punctuation.keeper.preserve.PunctuationPreserver;
import ai.punctuation.keeper.process.ChatModelChunkProcessor;
import ai.punctuation.keeper.process.ChunkProcessorFactory;
import ai.punctuation.keeper.process.MockChunkProcessor;
import ai.punctuation.keeper.process.PassThroughChunkProcessor;
import ai.punctuation.keeper.process.ProcessingException;
import ai.punctuation.keeper.process.ProcessingResult;
import ai.punctuation.keeper.process.ProcessingService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and processing pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final DocumentReader documentReader;
    private final DocumentWriter documentWriter;
    private final Function<ProcessorConfig, ChatModel> chatModelFactory;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentReader(), new DocumentWriter(),
                CliApplication::createOllamaChatModel);
    }

    CliApplication(ConfigLoader configLoader, DocumentReader documentReader, DocumentWriter documentWriter,
                   Function<ProcessorConfig, ChatModel> chatModelFactory) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.documentReader = Objects.requireNonNull(documentReader, "documentReader");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.chatModelFactory = Objects.requireNonNull(chatModelFactory, "chatModelFactory");
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Running with {} punctuation and {} processor (marks={})",
                config.punctuationMode(), config.processingMode(), config.markMatcher().marks());

        try {
            ProcessingService processingService = createProcessingService(config);
            List<String> lines = documentReader.read(config.input());
            ProcessingResult result = processingService.process(lines, config.punctuationMode(), config.processingMode());
            documentWriter.write(config.output(), result.lines());
            LOGGER.info("Processed {} lines into {} lines ({} chunks, {} marks)",
                    lines.size(), result.lines().size(), result.chunkCount(), result.markCount());
            if (!result.aligned()) {
                LOGGER.warn("Processor output was not aligned with its input; punctuation may be misplaced");
            }
            return 0;
        } catch (ProcessingException | UncheckedIOException | IllegalStateException ex) {
            LOGGER.error("Processing failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }

    private ProcessingService createProcessingService(Config config) {
        ChunkProcessorFactory factory = buildProcessorFactory(config);
        return new ProcessingService(factory, new PunctuationPreserver(config.markMatcher()),
                config.maxRetryAttempts(), config.initialBackoff(), config.maxBackoff());
    }

    private ChunkProcessorFactory buildProcessorFactory(Config config) {
        ProcessorConfig processorConfig = config.processorConfig();
        ChatModelChunkProcessor productionProcessor = new ChatModelChunkProcessor(
                chatModelFactory.apply(processorConfig), processorConfig.modelName(), processorConfig.instruction());
        return new ChunkProcessorFactory(productionProcessor, new PassThroughChunkProcessor(), new MockChunkProcessor());
    }

    private static ChatModel createOllamaChatModel(ProcessorConfig processorConfig) {
        try {
            LOGGER.info("Using Ollama model '{}' via {}", processorConfig.modelName(), processorConfig.baseUrl());
            return OllamaChatModel.builder()
                    .baseUrl(processorConfig.baseUrl().toString())
                    .modelName(processorConfig.modelName())
                    .temperature(0.1)
                    .timeout(Duration.ofMinutes(2))
                    .build();
        } catch (RuntimeException ex) {
            throw new IllegalStateException("Failed to initialize Ollama chat model", ex);
        }
    }
}
