package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.service.CommandResult;
import com.williamcallahan.baptismdesk.service.ExternalCommandRunner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stands in for python and soffice: records every command and fakes the files each one would
 * write into its working directory.
 */
public class ScriptedCommandRunner extends ExternalCommandRunner {

    private final List<List<String>> commands = Collections.synchronizedList(new ArrayList<>());
    private final List<String> renderInputs = Collections.synchronizedList(new ArrayList<>());
    private volatile CommandResult renderResult = new CommandResult(0, "", false);
    private volatile CommandResult convertResult = new CommandResult(0, "", false);
    private volatile CommandResult combineResult = new CommandResult(0, "", false);
    private volatile boolean convertWritesPreview = true;
    private volatile boolean convertUsesPageSuffix = false;
    private volatile Runnable beforeRender = () -> { };

    @Override
    public CommandResult run(List<String> command, Path workingDirectory, Duration timeout) {
        commands.add(List.copyOf(command));
        try {
            if (command.contains(CertificatePipeline.RENDER_SCRIPT)) {
                return render(command, workingDirectory);
            }
            if (command.contains("--convert-to")) {
                return convert(command, workingDirectory);
            }
            if (command.contains(CertificateCombiner.COMBINE_SCRIPT)) {
                return combine(command, workingDirectory);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return new CommandResult(127, "unknown command " + command, false);
    }

    private CommandResult render(List<String> command, Path workingDirectory) throws IOException {
        beforeRender.run();
        String instructions = Files.readString(workingDirectory.resolve(command.get(command.size() - 1)));
        renderInputs.add(instructions);
        String[] files = instructions.lines().findFirst().orElseThrow().split(" ");
        if (!Files.exists(workingDirectory.resolve(files[0]))) {
            return new CommandResult(1, "FileNotFoundError: " + files[0], false);
        }
        if (renderResult.succeeded()) {
            String outputFile = files[1];
            Files.writeString(workingDirectory.resolve(outputFile), "pptx:" + outputFile, StandardCharsets.UTF_8);
        }
        return renderResult;
    }

    private CommandResult convert(List<String> command, Path workingDirectory) throws IOException {
        if (convertResult.succeeded() && convertWritesPreview) {
            String document = command.get(command.size() - 1);
            String base = document.substring(0, document.length() - ".pptx".length());
            String preview = convertUsesPageSuffix ? base + "_1.png" : base + ".png";
            Files.writeString(workingDirectory.resolve(preview), "png:" + base, StandardCharsets.UTF_8);
        }
        return convertResult;
    }

    private CommandResult combine(List<String> command, Path workingDirectory) throws IOException {
        if (combineResult.succeeded()) {
            StringBuilder merged = new StringBuilder();
            for (String input : command.subList(command.indexOf(CertificateCombiner.COMBINE_SCRIPT) + 2, command.size())) {
                merged.append(Files.readString(workingDirectory.resolve(input))).append('|');
            }
            Files.writeString(workingDirectory.resolve(command.get(command.indexOf(CertificateCombiner.COMBINE_SCRIPT) + 1)),
                    merged.toString(), StandardCharsets.UTF_8);
        }
        return combineResult;
    }

    public List<List<String>> commands() {
        return List.copyOf(commands);
    }

    public List<String> renderInputs() {
        return List.copyOf(renderInputs);
    }

    public void failRender(int exitCode, String output) {
        renderResult = new CommandResult(exitCode, output, false);
    }

    public void timeOutConvert() {
        convertResult = new CommandResult(-1, "", true);
    }

    public void convertWithoutPreview() {
        convertWritesPreview = false;
    }

    public void convertWithPageSuffix() {
        convertUsesPageSuffix = true;
    }

    /** Runs {@code action} at the start of every render, before the instruction file is read. */
    public void beforeRender(Runnable action) {
        beforeRender = action;
    }

    public void failCombine(int exitCode, String output) {
        combineResult = new CommandResult(exitCode, output, false);
    }
}
