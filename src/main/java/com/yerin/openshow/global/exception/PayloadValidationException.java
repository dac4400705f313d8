package com.yerin.openshow.global.exception;

import com.yerin.openshow.global.exception.code.JobErrorCode;
import lombok.Getter;

import java.util.List;

/**
 * Raised when a payload does not satisfy the schema registered for its job type.
 * Carries every violation found, never only the first one.
 */
@Getter
public class PayloadValidationException extends AppException {

    private final String type;
    private final List<String> violations;

    public PayloadValidationException(String type, List<String> violations) {
        super(JobErrorCode.PAYLOAD_VALIDATION_FAILED.withDetail(String.join("; ", violations)));
        this.type = type;
        this.violations = List.copyOf(violations);
    }

    @Override
    public List<String> getDetails() {
        return violations;
    }
}
