package com.mergington.activities.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParticipantScore {
    private String email;

    // Score of the participant's first verified document, null when none is verified
    private Integer score;
}
