package com.myorg.esf.contracts.rpg.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ExperienceGained {
    private int experienceGained;
    private int totalExperience;
    private int experienceToNextLevel;
}
