package com.testflow.action.system;

import com.testflow.action.AbstractLogicAction;
import com.testflow.action.ActionContext;
import com.testflow.action.ActionDefinition;
import com.testflow.model.Environment;
import com.testflow.model.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes a message to the log at the configured level. {@code {name}} placeholders are
 * replaced by the current value of the variable of that name; placeholders naming an
 * undeclared variable are left as written.
 */
@ActionDefinition(type = "Log", category = "System",
                  description = "Log a message to the output")
public class LogAction extends AbstractLogicAction {

    private static final Logger  log         = LoggerFactory.getLogger(LogAction.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)\\}");

    private String message = "";
    private Level  level   = Level.INFO;

    public LogAction() {
        super("Log", "Log a message to the output");
    }

    public LogAction(Level level, String message) {
        this();
        setLevel(level);
        setMessage(message);
    }

    @Override
    protected boolean doExecute(ActionContext context) {
        log.atLevel(level).log(resolveMessage());
        return true;
    }

    /** The message with every resolvable placeholder substituted. */
    public String resolveMessage() {
        Environment environment = getEnvironment();
        if (message.isEmpty() || environment == null) {
            return message;
        }
        Matcher matcher = PLACEHOLDER.matcher(message);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            Optional<Variable> variable = environment.find(matcher.group(1));
            String replacement = variable
                .map(v -> v.getValue() != null ? v.getValue().toString() : "")
                .orElse(matcher.group());
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public String getMessage() { return message; }
    public Level  getLevel()   { return level; }

    public void setMessage(String message) { this.message = message != null ? message : ""; }
    public void setLevel(Level level)      { this.level = level != null ? level : Level.INFO; }
}
