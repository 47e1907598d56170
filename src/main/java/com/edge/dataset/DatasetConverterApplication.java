package com.edge.dataset;

import com.edge.dataset.cli.ConvertCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import picocli.CommandLine;

/**
 * 标注数据集格式转换工具入口
 */
@SpringBootApplication
public class DatasetConverterApplication implements CommandLineRunner, ExitCodeGenerator {

    private final ConvertCommand convertCommand;
    private int exitCode;

    public DatasetConverterApplication(ConvertCommand convertCommand) {
        this.convertCommand = convertCommand;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(DatasetConverterApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Override
    public void run(String... args) {
        CommandLine commandLine = new CommandLine(convertCommand);
        if (args.length == 0) {
            commandLine.usage(commandLine.getErr());
            exitCode = ConvertCommand.EXIT_USAGE;
            return;
        }
        exitCode = commandLine.execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
