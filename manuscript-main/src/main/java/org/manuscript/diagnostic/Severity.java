package org.manuscript.diagnostic;

public enum Severity {
    ERROR,
    WARNING
}
