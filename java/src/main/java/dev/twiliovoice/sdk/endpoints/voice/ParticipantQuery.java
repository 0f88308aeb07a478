package dev.twiliovoice.sdk.endpoints.voice;

import dev.twiliovoice.sdk.endpoints.PageQuery;

public final class ParticipantQuery extends PageQuery<ParticipantQuery> {

    @Override
    protected ParticipantQuery self() {
        return this;
    }

    public ParticipantQuery muted(boolean muted) {
        return add("Muted", muted);
    }

    public ParticipantQuery hold(boolean hold) {
        return add("Hold", hold);
    }

    public ParticipantQuery coaching(boolean coaching) {
        return add("Coaching", coaching);
    }
}
