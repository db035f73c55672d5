package org.fhirquery.core.exception;

/**
 * Base exception for all FHIR search errors.
 * <p>
 * Carries the FHIR issue type code that an OperationOutcome built from this
 * exception should report, plus optional diagnostics.
 * </p>
 */
public class FhirException extends RuntimeException {

    private final String issueCode;
    private final String diagnostics;

    public FhirException(String message) {
        this(message, "processing", (String) null);
    }

    public FhirException(String message, String issueCode) {
        this(message, issueCode, (String) null);
    }

    public FhirException(String message, String issueCode, String diagnostics) {
        super(message);
        this.issueCode = issueCode;
        this.diagnostics = diagnostics;
    }

    public FhirException(String message, String issueCode, Throwable cause) {
        super(message, cause);
        this.issueCode = issueCode;
        this.diagnostics = cause != null ? cause.getMessage() : null;
    }

    /**
     * Returns the FHIR issue type code for OperationOutcome.
     */
    public String getIssueCode() {
        return issueCode;
    }

    /**
     * Returns additional diagnostic information.
     */
    public String getDiagnostics() {
        return diagnostics;
    }
}
