package net.javahippie.fittracker.service;

import net.javahippie.fittracker.model.dto.ActivityRequest;

import java.util.List;

/**
 * Activities every new account starts with.
 */
final class DefaultActivityCatalog {

    static final List<ActivityRequest> ACTIVITIES = List.of(
        activity("💧 Hydration", "Drink water throughout the day", "💧", 8, "glasses", "nutrition"),
        activity("🏃 Cardio", "Cardiovascular exercise", "🏃", 30, "minutes", "exercise"),
        activity("🏋️ Strength", "Strength training workout", "🏋️", 45, "minutes", "exercise"),
        activity("🧘 Stretching", "Flexibility and mobility work", "🧘", 15, "minutes", "recovery"),
        activity("😴 Sleep", "Quality sleep", "😴", 8, "hours", "recovery"),
        activity("🥗 Healthy Meal", "Balanced, nutritious meal", "🥗", 3, "meals", "nutrition"),
        activity("📊 Track Progress", "Log weight or measurements", "📊", 1, "entry", "tracking")
    );

    private DefaultActivityCatalog() {
    }

    private static ActivityRequest activity(String name, String description, String icon,
                                            double targetValue, String targetUnit, String category) {
        return ActivityRequest.builder()
            .name(name)
            .description(description)
            .icon(icon)
            .targetValue(targetValue)
            .targetUnit(targetUnit)
            .category(category)
            .build();
    }
}
