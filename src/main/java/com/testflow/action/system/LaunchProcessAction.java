package com.testflow.action.system;

import com.testflow.action.AbstractAction;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.action.SyntaxValidator;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Starts an executable.
 *
 * Without {@code waitForCompletion} the action succeeds as soon as the process has
 * started. With it, the action waits up to {@code timeoutMillis}: a timeout kills the
 * process and fails, a non-zero exit code fails. Cancelling kills the child process;
 * this is the one action that is stopped forcibly rather than at a checkpoint.
 */
@ActionDefinition(type = "LaunchProcess", category = "System",
                  description = "Launch an application or execute a command")
public class LaunchProcessAction extends AbstractAction implements SyntaxValidator {

    private static final Logger log = LoggerFactory.getLogger(LaunchProcessAction.class);

    public static final long DEFAULT_TIMEOUT_MILLIS = 30_000;

    private String  executablePath    = "";
    private String  arguments         = "";
    private String  workingDirectory  = "";
    private boolean waitForCompletion;
    private long    timeoutMillis     = DEFAULT_TIMEOUT_MILLIS;
    private volatile Process process;

    public LaunchProcessAction() {
        super("Launch Process", "Launch an application or execute a command");
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        if (context.isCancellationRequested()) {
            return false;
        }
        List<String> command = new ArrayList<>();
        command.add(executablePath);
        command.addAll(splitArguments(arguments));

        ProcessBuilder builder = new ProcessBuilder(command);
        if (!workingDirectory.isBlank()) {
            builder.directory(new File(workingDirectory));
        }

        try {
            process = builder.start();
        } catch (IOException e) {
            return fail("Could not start '" + executablePath + "': " + e.getMessage());
        }
        log.info("LaunchProcessAction: started '{}' (pid {})", executablePath, process.pid());

        Runnable registration = context.getToken().register(this::killProcess);
        try {
            if (!waitForCompletion) {
                return true;
            }
            boolean exited = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
            if (context.isCancellationRequested()) {
                return false;
            }
            if (!exited) {
                killProcess();
                return fail("'" + executablePath + "' did not exit within " + timeoutMillis + "ms");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return fail("'" + executablePath + "' exited with code " + exitCode);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            killProcess();
            return fail("Interrupted while waiting for '" + executablePath + "'");
        } finally {
            registration.run();
        }
    }

    private void killProcess() {
        Process running = process;
        if (running != null && running.isAlive()) {
            log.info("LaunchProcessAction: killing '{}' (pid {})", executablePath, running.pid());
            running.destroyForcibly();
        }
    }

    /** Splits on whitespace; double quotes group words and are removed. */
    static List<String> splitArguments(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isBlank()) return parts;
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean pending = false;
        for (char c : text.toCharArray()) {
            if (c == '"') {
                quoted = !quoted;
                pending = true;
            } else if (Character.isWhitespace(c) && !quoted) {
                if (pending) {
                    parts.add(current.toString());
                    current.setLength(0);
                    pending = false;
                }
            } else {
                current.append(c);
                pending = true;
            }
        }
        if (pending) parts.add(current.toString());
        return parts;
    }

    @Override
    public List<SyntaxError> validate(ValidationContext context) {
        List<SyntaxError> errors = new ArrayList<>();
        if (executablePath.isBlank()) {
            errors.add(SyntaxError.critical(this, "ExecutablePath", "Executable path cannot be empty"));
        }
        if (waitForCompletion && timeoutMillis <= 0) {
            errors.add(SyntaxError.error(this, "TimeoutMillis", "Timeout must be positive when waiting for completion"));
        }
        return errors;
    }

    public String  getExecutablePath()    { return executablePath; }
    public String  getArguments()         { return arguments; }
    public String  getWorkingDirectory()  { return workingDirectory; }
    public boolean isWaitForCompletion()  { return waitForCompletion; }
    public long    getTimeoutMillis()     { return timeoutMillis; }

    public void setExecutablePath(String executablePath)     { this.executablePath = executablePath != null ? executablePath : ""; }
    public void setArguments(String arguments)               { this.arguments = arguments != null ? arguments : ""; }
    public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory != null ? workingDirectory : ""; }
    public void setWaitForCompletion(boolean waitForCompletion) { this.waitForCompletion = waitForCompletion; }
    public void setTimeoutMillis(long timeoutMillis)         { this.timeoutMillis = timeoutMillis; }
}
