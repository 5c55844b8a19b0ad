package org.gridmaze.heuristic;

import lombok.experimental.UtilityClass;

import java.util.Locale;

/**
 * Strict heuristic factory.
 *
 * <p>Centralizes name and type resolution so every planner receives heuristics created
 * under the same contracts and deterministic failure reason codes.</p>
 */
@UtilityClass
public class HeuristicFactory {
    public static final String REASON_TYPE_REQUIRED = "HEURISTIC_TYPE_REQUIRED";
    public static final String REASON_CUSTOM_NOT_CONSTRUCTIBLE = "HEURISTIC_CUSTOM_NOT_CONSTRUCTIBLE";
    public static final String REASON_NAME_REQUIRED = "HEURISTIC_NAME_REQUIRED";
    public static final String REASON_UNKNOWN_NAME = "HEURISTIC_UNKNOWN_NAME";

    /**
     * Creates the stock heuristic for a type.
     *
     * @param type requested heuristic type.
     * @return stateless heuristic instance.
     * @throws HeuristicConfigurationException when {@code type} is null or {@code CUSTOM}.
     */
    public static Heuristic create(HeuristicType type) {
        if (type == null) {
            throw new HeuristicConfigurationException(
                    REASON_TYPE_REQUIRED,
                    "heuristic type must be explicitly specified (NONE, MANHATTAN, EUCLIDEAN)"
            );
        }
        return switch (type) {
            case NONE -> Heuristics.ZERO;
            case MANHATTAN -> Heuristics.MANHATTAN;
            case EUCLIDEAN -> Heuristics.EUCLIDEAN;
            case CUSTOM -> throw new HeuristicConfigurationException(
                    REASON_CUSTOM_NOT_CONSTRUCTIBLE,
                    "CUSTOM heuristics must be supplied as an instance, not created from a type"
            );
        };
    }

    /**
     * Resolves a user-facing heuristic name.
     *
     * <p>Accepted (case-insensitive): {@code manhattan|manh|m}, {@code euclidean|eucl|e},
     * {@code zero|none}.</p>
     *
     * @throws HeuristicConfigurationException for blank or unknown names.
     */
    public static HeuristicType parse(String name) {
        if (name == null || name.isBlank()) {
            throw new HeuristicConfigurationException(REASON_NAME_REQUIRED, "heuristic name must be provided");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "manhattan", "manh", "m" -> HeuristicType.MANHATTAN;
            case "euclidean", "eucl", "e" -> HeuristicType.EUCLIDEAN;
            case "zero", "none" -> HeuristicType.NONE;
            default -> throw new HeuristicConfigurationException(
                    REASON_UNKNOWN_NAME,
                    "unknown heuristic '" + name + "'; use manhattan | euclidean | zero"
            );
        };
    }
}
