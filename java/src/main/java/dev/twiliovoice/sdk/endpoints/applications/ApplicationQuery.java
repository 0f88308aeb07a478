package dev.twiliovoice.sdk.endpoints.applications;

import dev.twiliovoice.sdk.endpoints.PageQuery;

public final class ApplicationQuery extends PageQuery<ApplicationQuery> {

    @Override
    protected ApplicationQuery self() {
        return this;
    }

    public ApplicationQuery friendlyName(String friendlyName) {
        return add("FriendlyName", friendlyName);
    }
}
