package com.myorg.esf.contracts.rpg.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class DamageTaken {
    private int damage;
    private int remainingHealth;
}
