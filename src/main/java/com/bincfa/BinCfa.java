package com.bincfa;

import com.bincfa.analysis.CfaInitializer;
import com.bincfa.config.ConfigManager;
import com.bincfa.config.IllegalConfigurationException;
import com.bincfa.config.InitialConfiguration;
import com.bincfa.domain.ConfigSnapshotDomain;
import com.bincfa.domain.SnapshotValue;
import com.bincfa.graph.Cfa;
import com.bincfa.graph.CfaStore;
import com.bincfa.graph.State;
import com.bincfa.report.CfaPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.Callable;

@Command(name = "bincfa", mixinStandardHelpOptions = true, version = "1.0",
        description = "Control flow automaton engine for abstract interpretation of machine code",
        subcommands = {BinCfa.InitCommand.class, BinCfa.DumpCommand.class})
public class BinCfa implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(BinCfa.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new BinCfa()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    @Command(name = "init", description = "Seed the root state from a configuration and checkpoint it")
    public static class InitCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Configuration file (created from the default template if missing)")
        private File configFile;

        @Option(names = {"-o", "--output"}, defaultValue = "cfa.bin", description = "Checkpoint file to write")
        private File output;

        @Option(names = {"-d", "--dump"}, description = "Also write a human readable dump")
        private File dump;

        @Override
        public Integer call() {
            ConfigManager configManager = new ConfigManager();
            try {
                configManager.init(configFile);
                InitialConfiguration config = configManager.resolve();

                Cfa<SnapshotValue> cfa = Cfa.create(new ConfigSnapshotDomain());
                State<SnapshotValue> root = new CfaInitializer<>(cfa.getDomain(), config).initState(cfa);
                CfaStore.marshal(output.toPath(), cfa);
                System.out.println("Root state " + root.getId() + " at " + root.getIp() + " written to " + output);

                if (dump != null) {
                    new CfaPrinter(config.getLogLevel()).print(dump.toPath(), cfa);
                }
                return 0;
            } catch (IllegalConfigurationException e) {
                logger.error("Analysis aborted: {}", e.getMessage());
                return 1;
            } catch (IOException e) {
                logger.error("Failed to write CFA", e);
                return 1;
            }
        }
    }

    @Command(name = "dump", description = "Print a checkpointed CFA")
    public static class DumpCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Checkpoint file written by 'init' or by an analysis")
        private File input;

        @Option(names = {"-o", "--output"}, defaultValue = "cfa.txt", description = "Dump file to write")
        private File output;

        @Option(names = {"-v", "--verbosity"}, defaultValue = "2", description = "Statements are listed above 2")
        private int verbosity;

        @Override
        public Integer call() {
            try {
                Cfa<SnapshotValue> cfa = CfaStore.unmarshal(input.toPath(), new ConfigSnapshotDomain());
                new CfaPrinter(verbosity).print(output.toPath(), cfa);
                System.out.println("Dumped " + cfa.size() + " states to " + output);
                return 0;
            } catch (IOException e) {
                logger.error("Failed to read CFA checkpoint {}", input, e);
                return 1;
            }
        }
    }
}
