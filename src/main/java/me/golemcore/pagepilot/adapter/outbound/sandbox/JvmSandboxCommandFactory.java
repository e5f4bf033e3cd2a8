package me.golemcore.pagepilot.adapter.outbound.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.pagepilot.sandbox.SandboxMain;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.jar.JarFile;

/**
 * Starts {@link SandboxMain} in a fresh JVM with the same Java binary and
 * classpath as the current process. When running from a Spring Boot
 * executable jar, the child goes through the Boot {@code PropertiesLauncher}
 * so nested jars resolve.
 */
@Slf4j
public class JvmSandboxCommandFactory implements SandboxCommandFactory {

    static final String BOOT_LAUNCHER = "org.springframework.boot.loader.launch.PropertiesLauncher";
    private static final String BOOT_LAUNCHER_ENTRY = BOOT_LAUNCHER.replace('.', '/') + ".class";

    private final String javaExecutable;
    private final String classPath;
    private final List<String> jvmOptions;
    private final boolean bootJar;

    public JvmSandboxCommandFactory(List<String> jvmOptions) {
        this(currentJavaExecutable(), System.getProperty("java.class.path"), jvmOptions);
    }

    JvmSandboxCommandFactory(String javaExecutable, String classPath, List<String> jvmOptions) {
        this.javaExecutable = javaExecutable;
        this.classPath = classPath;
        this.jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
        this.bootJar = isBootJar(classPath);
        log.debug("[Sandbox] Child JVM: {} (boot jar: {})", javaExecutable, bootJar);
    }

    @Override
    public List<String> command(Path jobFile) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(jvmOptions);
        if (bootJar) {
            command.add("-Dloader.main=" + SandboxMain.class.getName());
            command.add("-cp");
            command.add(classPath);
            command.add(BOOT_LAUNCHER);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(SandboxMain.class.getName());
        }
        command.add(jobFile.toAbsolutePath().toString());
        return command;
    }

    private static String currentJavaExecutable() {
        return ProcessHandle.current().info().command()
                .orElseGet(() -> Path.of(System.getProperty("java.home"), "bin", "java").toString());
    }

    private static boolean isBootJar(String classPath) {
        if (classPath == null || classPath.contains(File.pathSeparator) || !classPath.endsWith(".jar")) {
            return false;
        }
        Path jar = Path.of(classPath);
        if (!Files.isRegularFile(jar)) {
            return false;
        }
        try (JarFile jarFile = new JarFile(jar.toFile())) {
            return jarFile.getEntry(BOOT_LAUNCHER_ENTRY) != null;
        } catch (IOException e) {
            log.warn("[Sandbox] Cannot inspect {}: {}", jar, e.getMessage());
            return false;
        }
    }
}
