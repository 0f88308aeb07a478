package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.PageQuery;

/**
 * Filters for {@link ListConferences}. Dates are sent in {@code YYYY-MM-DD} form; the {@code Before} and
 * {@code After} variants map to the API's {@code <} and {@code >} suffixed parameters.
 */
public final class ConferenceQuery extends PageQuery<ConferenceQuery> {

    @Override
    protected ConferenceQuery self() {
        return this;
    }

    public ConferenceQuery friendlyName(String friendlyName) {
        return add("FriendlyName", friendlyName);
    }

    public ConferenceQuery status(ConferenceStatus status) {
        return add("Status", status);
    }

    public ConferenceQuery dateCreated(String date) {
        return add("DateCreated", date);
    }

    public ConferenceQuery dateCreatedBefore(String date) {
        return add("DateCreated<", date);
    }

    public ConferenceQuery dateCreatedAfter(String date) {
        return add("DateCreated>", date);
    }

    public ConferenceQuery dateUpdated(String date) {
        return add("DateUpdated", date);
    }

    public ConferenceQuery dateUpdatedBefore(String date) {
        return add("DateUpdated<", date);
    }

    public ConferenceQuery dateUpdatedAfter(String date) {
        return add("DateUpdated>", date);
    }
}
