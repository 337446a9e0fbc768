package com.bbthechange.watcher.testutil;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Tries a file lock from a separate JVM, the way a second runner on the same host would.
 * Prints ACQUIRED or BLOCKED.
 */
public final class ExternalLockAttempt {

    public static final String ACQUIRED = "ACQUIRED";
    public static final String BLOCKED = "BLOCKED";

    private ExternalLockAttempt() {
    }

    public static void main(String[] args) throws Exception {
        try (FileChannel channel = FileChannel.open(Path.of(args[0]),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                System.out.println(BLOCKED);
            } else {
                System.out.println(ACQUIRED);
                lock.release();
            }
        }
    }

    /**
     * Run the attempt in a child JVM and return what it printed.
     */
    public static String runAgainst(Path lockFile) throws Exception {
        Path javaBin = Path.of(System.getProperty("java.home"), "bin", "java");
        Path classes = Path.of(ExternalLockAttempt.class.getProtectionDomain().getCodeSource().getLocation().toURI());
        Process process = new ProcessBuilder(List.of(
                javaBin.toString(), "-cp", classes.toString(),
                ExternalLockAttempt.class.getName(), lockFile.toAbsolutePath().toString()))
                .redirectErrorStream(true)
                .start();
        if (!process.waitFor(30, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            throw new IllegalStateException("Lock attempt did not finish");
        }
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            String last = null;
            while ((line = reader.readLine()) != null) {
                last = line.trim();
            }
            return last;
        }
    }
}
