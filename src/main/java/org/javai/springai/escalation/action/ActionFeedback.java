package org.javai.springai.escalation.action;

/**
 * Post-hoc report from the action executor about a committed decision.
 *
 * @param kind kind of the executed action
 * @param status how the execution went
 * @param reasonCode short machine-readable reason, may be empty
 * @param detail free-form detail, may be empty
 */
public record ActionFeedback(
		String kind,
		FeedbackStatus status,
		String reasonCode,
		String detail
) {

	public ActionFeedback {
		if (kind == null || kind.isBlank()) {
			throw new IllegalArgumentException("kind must not be blank");
		}
		if (status == null) {
			throw new IllegalArgumentException("status must not be null");
		}
		reasonCode = reasonCode == null ? "" : reasonCode;
		detail = detail == null ? "" : detail;
	}

	public static ActionFeedback success(String kind) {
		return new ActionFeedback(kind, FeedbackStatus.SUCCESS, "", "");
	}

	public static ActionFeedback failed(String kind, String reasonCode, String detail) {
		return new ActionFeedback(kind, FeedbackStatus.FAILED, reasonCode, detail);
	}

	public boolean isFailure() {
		return status == FeedbackStatus.FAILED;
	}
}
