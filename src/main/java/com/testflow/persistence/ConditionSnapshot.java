package com.testflow.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.testflow.locator.IdentifierKind;

/**
 * The condition of an if, while or for action. An absent condition has no snapshot.
 *
 *   LITERAL         text is "true" or "false"
 *   EXPRESSION      text is the expression source, re-parsed on load
 *   ELEMENT_EXISTS  identifierKind, identifier, retryTimes and timeoutMillis
 *   UNSUPPORTED     text describes the value that could not be a condition
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConditionSnapshot {

    public enum Kind {
        LITERAL,
        EXPRESSION,
        ELEMENT_EXISTS,
        UNSUPPORTED
    }

    private Kind           kind;
    private String         text;

    // ELEMENT_EXISTS only
    private IdentifierKind identifierKind;
    private String         identifier;
    private Integer        retryTimes;
    private Long           timeoutMillis;

    public ConditionSnapshot() {}

    public ConditionSnapshot(Kind kind, String text) {
        this.kind = kind;
        this.text = text;
    }

    public static ConditionSnapshot elementExists(IdentifierKind identifierKind, String identifier,
                                                  int retryTimes, long timeoutMillis) {
        ConditionSnapshot snapshot = new ConditionSnapshot(Kind.ELEMENT_EXISTS, null);
        snapshot.identifierKind = identifierKind;
        snapshot.identifier     = identifier;
        snapshot.retryTimes     = retryTimes;
        snapshot.timeoutMillis  = timeoutMillis;
        return snapshot;
    }

    public Kind           getKind()           { return kind; }
    public String         getText()           { return text; }
    public IdentifierKind getIdentifierKind() { return identifierKind; }
    public String         getIdentifier()     { return identifier; }
    public Integer        getRetryTimes()     { return retryTimes; }
    public Long           getTimeoutMillis()  { return timeoutMillis; }

    public void setKind(Kind kind)                              { this.kind = kind; }
    public void setText(String text)                            { this.text = text; }
    public void setIdentifierKind(IdentifierKind identifierKind) { this.identifierKind = identifierKind; }
    public void setIdentifier(String identifier)                { this.identifier = identifier; }
    public void setRetryTimes(Integer retryTimes)               { this.retryTimes = retryTimes; }
    public void setTimeoutMillis(Long timeoutMillis)            { this.timeoutMillis = timeoutMillis; }
}
