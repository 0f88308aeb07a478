package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.PageQuery;

/**
 * Filters accepted by {@link ListCalls}.
 */
public final class CallQuery extends PageQuery<CallQuery> {

    @Override
    protected CallQuery self() {
        return this;
    }

    public CallQuery to(String to) {
        return add("To", to);
    }

    public CallQuery from(String from) {
        return add("From", from);
    }

    public CallQuery parentCallSid(String parentCallSid) {
        return add("ParentCallSid", parentCallSid);
    }

    public CallQuery status(CallStatus status) {
        return add("Status", status);
    }

    /**
     * Only include calls that started on this date ({@code YYYY-MM-DD}, UTC).
     */
    public CallQuery startTime(String date) {
        return add("StartTime", date);
    }

    /**
     * Only include calls that started on or before this date.
     */
    public CallQuery startTimeBefore(String date) {
        return add("StartTime<", date);
    }

    /**
     * Only include calls that started on or after this date.
     */
    public CallQuery startTimeAfter(String date) {
        return add("StartTime>", date);
    }

    /**
     * Only include calls that ended on this date ({@code YYYY-MM-DD}, UTC).
     */
    public CallQuery endTime(String date) {
        return add("EndTime", date);
    }

    public CallQuery endTimeBefore(String date) {
        return add("EndTime<", date);
    }

    public CallQuery endTimeAfter(String date) {
        return add("EndTime>", date);
    }
}
