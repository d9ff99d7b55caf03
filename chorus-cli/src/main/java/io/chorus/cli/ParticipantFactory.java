package io.chorus.cli;

import io.chorus.core.config.model.ChorusConfig;
import io.chorus.core.participant.Participant;
import java.util.List;

@FunctionalInterface
public interface ParticipantFactory {
    List<Participant> create(ChorusConfig config);
}
