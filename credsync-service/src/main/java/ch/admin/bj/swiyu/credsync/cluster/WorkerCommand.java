/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.credsync.cluster;

import java.lang.management.ManagementFactory;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line starting a worker JVM.
 */
public record WorkerCommand(List<String> arguments) {

    public WorkerCommand {
        arguments = List.copyOf(arguments);
    }

    /**
     * Same java binary, JVM options, classpath (or executable jar) and program arguments as the running primary.
     */
    public static WorkerCommand forCurrentJvm(Class<?> mainClass, String[] args) {
        var command = new ArrayList<String>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        ManagementFactory.getRuntimeMXBean().getInputArguments().stream()
                // a debug agent would try to bind the primary's debug port again
                .filter(argument -> !argument.startsWith("-agentlib:jdwp") && !argument.startsWith("-Xrunjdwp"))
                .forEach(command::add);

        var launchTarget = System.getProperty("sun.java.command", "").split(" ")[0];
        if (launchTarget.endsWith(".jar")) {
            command.add("-jar");
            command.add(launchTarget);
        } else {
            command.add("-cp");
            command.add(System.getProperty("java.class.path"));
            command.add(mainClass.getName());
        }
        command.addAll(List.of(args));
        return new WorkerCommand(command);
    }
}
