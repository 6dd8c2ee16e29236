package com.testflow.locator;

/** The node attributes a locator can match on. */
public enum ElementAttribute {
    NAME,
    AUTOMATION_ID,
    CLASS_NAME,
    CONTROL_TYPE,
    /** Text or value content, e.g. an input's current value. Read for text searches only. */
    VALUE
}
