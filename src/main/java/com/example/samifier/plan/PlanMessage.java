package com.example.samifier.plan;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Free-form note attached to a run
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlanMessage {

    public enum Level { INFO, WARN }

    private Level level;

    private String text;
}
