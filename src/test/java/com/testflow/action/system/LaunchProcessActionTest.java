package com.testflow.action.system;

import com.testflow.action.ActionContext;
import com.testflow.action.ActionResult;
import com.testflow.action.CancellationToken;
import com.testflow.flow.SyntaxError;
import com.testflow.flow.ValidationContext;
import org.testng.annotations.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LaunchProcessActionTest {

    @Test
    public void splitArguments_honoursDoubleQuotes() {
        assertThat(LaunchProcessAction.splitArguments("-a  --name \"John Smith\" x"))
            .containsExactly("-a", "--name", "John Smith", "x");
        assertThat(LaunchProcessAction.splitArguments("\"\" end")).containsExactly("", "end");
        assertThat(LaunchProcessAction.splitArguments("   ")).isEmpty();
        assertThat(LaunchProcessAction.splitArguments(null)).isEmpty();
    }

    @Test
    public void missingExecutable_failsWithoutThrowing() {
        LaunchProcessAction action = new LaunchProcessAction();
        action.setExecutablePath("/definitely/not/here/testflow-missing-binary");

        ActionResult result = action.execute(new ActionContext(CancellationToken.NONE));

        assertThat(result.isFailed()).isTrue();
        assertThat(result.getMessage()).startsWith("Could not start");
    }

    @Test
    public void validate_requiresExecutableAndPositiveTimeoutWhenWaiting() {
        LaunchProcessAction action = new LaunchProcessAction();
        action.setWaitForCompletion(true);
        action.setTimeoutMillis(0);

        assertThat(action.validate(new ValidationContext("Flow.actions[0]", null, null, null)))
            .extracting(SyntaxError::getPropertyName)
            .containsExactly("ExecutablePath", "TimeoutMillis");
    }

    @Test
    public void defaults() {
        LaunchProcessAction action = new LaunchProcessAction();
        action.setArguments(null);

        assertThat(action.getTimeoutMillis()).isEqualTo(LaunchProcessAction.DEFAULT_TIMEOUT_MILLIS);
        assertThat(action.isWaitForCompletion()).isFalse();
        assertThat(action.getArguments()).isEmpty();
    }
}
