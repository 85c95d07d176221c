package com.bountypipe.screener.service.validation;

import com.bountypipe.screener.common.exception.ValidationException;
import com.bountypipe.screener.dto.ValidationResult;
import com.bountypipe.screener.enums.EvaluationStatus;
import com.bountypipe.screener.enums.GoNoGo;
import com.bountypipe.screener.enums.ImplementationStatus;
import com.bountypipe.screener.model.Bounty;
import com.bountypipe.screener.model.InternalTracking;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

import static com.bountypipe.screener.common.exception.ValidationException.INCONSISTENT_FLAGS;
import static com.bountypipe.screener.common.exception.ValidationException.MISSING_FIELD;
import static com.bountypipe.screener.common.exception.ValidationException.OUT_OF_RANGE;

/**
 * Shape checks for ingested records. Missing values are rejected, never defaulted.
 */
@Slf4j
@Component
public class BountyValidator {

    public ValidationResult validate(Bounty bounty) {
        if (bounty == null) {
            ValidationResult r = new ValidationResult(null);
            r.addError(MISSING_FIELD, "record is required");
            return r;
        }
        ValidationResult r = new ValidationResult(bounty.getId());
        checkIdentity(bounty, r);
        InternalTracking t = bounty.getInternal();
        if (t == null) {
            r.addError(MISSING_FIELD, "internal tracking block is missing");
            return r;
        }
        checkRange(r, "complexity_score", t.getComplexityScore(), 1, 10);
        checkRange(r, "success_probability", t.getSuccessProbability(), 0, 100);
        checkRange(r, "evaluation_confidence", t.getEvaluationConfidence(), 0, 100);

        if (t.getEvaluationStatus() == EvaluationStatus.EVALUATED) {
            if (t.getComplexityScore() == null) r.addError(MISSING_FIELD, "evaluated record has no complexity_score");
            if (t.getSuccessProbability() == null) r.addError(MISSING_FIELD, "evaluated record has no success_probability");
        }
        if (t.getGoNoGo() == GoNoGo.GO && t.getEvaluationStatus() != EvaluationStatus.EVALUATED) {
            r.addWarning(INCONSISTENT_FLAGS, "go verdict on a record that is not evaluated");
        }
        if (isReadyWithoutCompletion(t)) {
            r.addWarning(INCONSISTENT_FLAGS, "ready_for_submission set while implementation_status is " + t.getImplementationStatus());
        }
        return r;
    }

    /**
     * Minimal checks before any text scoring: identity, title, organization and reward.
     */
    public void requireIngestible(Bounty bounty) {
        ValidationResult r = new ValidationResult(bounty == null ? null : bounty.getId());
        if (bounty == null) {
            r.addError(MISSING_FIELD, "record is required");
        } else {
            checkIdentity(bounty, r);
        }
        throwIfInvalid(r);
    }

    /**
     * Full shape check. Warnings are logged, errors thrown.
     *
     * @throws ValidationException carrying the code of the first error
     */
    public void requireValid(Bounty bounty) {
        ValidationResult r = validate(bounty);
        if (!r.getWarnings().isEmpty()) {
            log.warn("record {} accepted with warnings: {}", r.getRecordId(),
                    r.getWarnings().stream().map(ValidationResult.Violation::message).collect(Collectors.joining("; ")));
        }
        throwIfInvalid(r);
    }

    public static boolean isReadyWithoutCompletion(InternalTracking t) {
        return Boolean.TRUE.equals(t.getReadyForSubmission())
                && t.getImplementationStatus() != ImplementationStatus.COMPLETED;
    }

    private static void checkIdentity(Bounty bounty, ValidationResult r) {
        if (isBlank(bounty.getId())) r.addError(MISSING_FIELD, "id is required");
        if (bounty.getTitle() == null) r.addError(MISSING_FIELD, "title is required");
        if (isBlank(bounty.getOrganization())) r.addError(MISSING_FIELD, "organization is required");
        if (bounty.getRewardAmount() == null) {
            r.addError(MISSING_FIELD, "reward amount is required");
        } else if (bounty.getRewardAmount() < 0) {
            r.addError(OUT_OF_RANGE, "reward amount must be non-negative, was " + bounty.getRewardAmount());
        }
    }

    private static void checkRange(ValidationResult r, String field, Integer value, int lo, int hi) {
        if (value != null && (value < lo || value > hi)) {
            r.addError(OUT_OF_RANGE, field + " must be within [" + lo + "," + hi + "], was " + value);
        }
    }

    private static void throwIfInvalid(ValidationResult r) {
        if (r.isValid()) return;
        String code = r.getErrors().get(0).code();
        String message = "record " + (r.getRecordId() == null ? "<no id>" : r.getRecordId()) + " rejected: "
                + r.getErrors().stream().map(ValidationResult.Violation::message).collect(Collectors.joining("; "));
        throw new ValidationException(code, message);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
