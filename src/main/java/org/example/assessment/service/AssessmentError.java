package org.example.assessment.service;

/**
 * Failure codes surfaced by the assessment workflow, grouped by category.
 */
public enum AssessmentError {

    NOT_OWNER(Category.AUTHORIZATION, "Caller is not the owner"),
    CALLER_NOT_AUTHORIZED(Category.AUTHORIZATION, "Caller not authorized"),

    ALREADY_IN_PROGRESS(Category.STATE_CONFLICT, "An assessment is already in progress"),
    ALREADY_SUBMITTED(Category.STATE_CONFLICT, "Answers already submitted"),
    ALREADY_VERIFYING(Category.STATE_CONFLICT, "Verification already requested"),
    ALREADY_COMPLETED(Category.STATE_CONFLICT, "Assessment already completed"),
    NO_ACTIVE_ASSESSMENT(Category.STATE_CONFLICT, "No active assessment"),
    NO_ASSESSMENT(Category.STATE_CONFLICT, "No assessment found"),
    ANSWERS_NOT_SUBMITTED(Category.STATE_CONFLICT, "Answers have not been submitted"),
    SET_INACTIVE(Category.STATE_CONFLICT, "Question set is not active"),
    DUPLICATE_ID(Category.STATE_CONFLICT, "Question set already exists"),
    DUPLICATE_REQUEST(Category.STATE_CONFLICT, "Request id already outstanding"),

    SET_NOT_FOUND(Category.NOT_FOUND, "Question set does not exist"),
    UNKNOWN_REQUEST(Category.NOT_FOUND, "Unknown request"),

    INVALID_ANSWERS_HASH(Category.VALIDATION, "Answers hash must be non-zero"),
    INVALID_QUESTION_COUNT(Category.VALIDATION, "Question count must be greater than zero"),
    INVALID_THRESHOLD(Category.VALIDATION, "Threshold must be between 0 and 100"),
    INVALID_REWARD_AMOUNT(Category.VALIDATION, "Amount must be between 0 and 2^256 - 1"),
    INVALID_QUESTION_SET_ID(Category.VALIDATION, "Question set id is invalid"),
    INVALID_CONTENT_HASH(Category.VALIDATION, "Content hash is invalid"),
    INVALID_RESULT_HASH(Category.VALIDATION, "Result hash is invalid"),
    INVALID_IDENTITY(Category.VALIDATION, "Identity is invalid"),
    MALFORMED_EVALUATION_RESULT(Category.VALIDATION, "Evaluation result is malformed"),

    SOURCE_NOT_CONFIGURED(Category.CONFIGURATION, "Evaluation source not configured"),
    SUBSCRIPTION_NOT_CONFIGURED(Category.CONFIGURATION, "Subscription not configured"),

    POINTS_NON_TRANSFERABLE(Category.LEDGER, "Points are non-transferable");

    private final Category category;
    private final String defaultMessage;

    AssessmentError(Category category, String defaultMessage) {
        this.category = category;
        this.defaultMessage = defaultMessage;
    }

    public Category getCategory() {
        return category;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public enum Category {
        AUTHORIZATION,
        STATE_CONFLICT,
        NOT_FOUND,
        VALIDATION,
        CONFIGURATION,
        LEDGER
    }
}
