package com.agentguard.api.dto.response;

import com.agentguard.domain.enums.KillSwitchState;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class KillSwitchResponse {

    private boolean enabled;
    private KillSwitchState state;
    private String message;
    private Instant updatedAt;
}
