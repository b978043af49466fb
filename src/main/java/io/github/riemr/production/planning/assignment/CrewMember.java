package io.github.riemr.production.planning.assignment;

import lombok.Value;

@Value
public class CrewMember {
    Long workerId;
    int level;
}
