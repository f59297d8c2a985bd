package io.docflow.core.execution.executor;

import io.docflow.core.llm.IntakeClassification;
import io.docflow.core.llm.IntakeClassifier;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/// Mechanical intake sufficiency check by keyword matching.
///
/// Intake is sufficient once both the artifact type (what is being built) and the
/// audience (who it is for) are known. Fields already extracted are never
/// re-extracted or re-asked. Reports `qualified` (or the first allowed outcome when
/// `qualified` is not declared) once sufficient.
public class KeywordIntakeClassifier implements IntakeClassifier {

    public static final String QUALIFIED = "qualified";
    public static final String ARTIFACT_TYPE = "artifact_type";
    public static final String AUDIENCE = "audience";
    public static final String PROJECT_CATEGORY = "project_category";

    private static final Map<Pattern, String> ARTIFACT_TYPES = new LinkedHashMap<>();
    private static final Map<Pattern, String> AUDIENCES = new LinkedHashMap<>();
    private static final Map<Pattern, String> CATEGORIES = new LinkedHashMap<>();

    static {
        artifact("\\bweb\\s*app(?:lication)?\\b", "web_application");
        artifact("\\bwebsite\\b", "website");
        artifact("\\b(?:mobile|ios|android)\\s*app(?:lication)?\\b", "mobile_application");
        artifact("\\bdesktop\\s*app(?:lication)?\\b", "desktop_application");
        artifact("\\bapi\\b", "api");
        artifact("\\b(?:backend|service)\\b", "backend_service");
        artifact("\\bdashboard\\b", "dashboard");
        artifact("\\bportal\\b", "portal");
        artifact("\\bplatform\\b", "platform");
        artifact("\\btool\\b", "tool");
        artifact("\\b(?:app|application|software|system)\\b", "application");

        audience("\\b(?:kids?|children)\\b", "children");
        audience("\\bteen(?:ager)?s?\\b", "teenagers");
        audience("\\bstudents?\\b", "students");
        audience("\\b(?:customers?|clients?)\\b", "customers");
        audience("\\b(?:internal|employees?|staff|team)\\b", "internal_team");
        audience("\\b(?:developers?|engineers?)\\b", "developers");
        audience("\\badults?\\b", "adults");
        audience("\\b(?:public|everyone|anyone)\\b", "general_public");

        CATEGORIES.put(Pattern.compile("\\bmigrat(?:e|ion)\\b"), "migration");
        CATEGORIES.put(Pattern.compile("\\bintegrat(?:e|ion)\\b"), "integration");
        CATEGORIES.put(Pattern.compile("\\b(?:enhance|improve|extend|existing)\\b"), "enhancement");
    }

    private static void artifact(String regex, String value) {
        ARTIFACT_TYPES.put(Pattern.compile(regex), value);
    }

    private static void audience(String regex, String value) {
        AUDIENCES.put(Pattern.compile(regex), value);
    }

    @Override
    public IntakeClassification classify(
            String input, Map<String, Object> previousFrame, List<String> allowedOutcomes) {
        String text = input.toLowerCase(Locale.ROOT);
        Map<String, Object> frame = new LinkedHashMap<>(previousFrame);
        frame.computeIfAbsent(ARTIFACT_TYPE, k -> firstMatch(ARTIFACT_TYPES, text));
        frame.computeIfAbsent(AUDIENCE, k -> firstMatch(AUDIENCES, text));
        String category = firstMatch(CATEGORIES, text);
        frame.put(PROJECT_CATEGORY, category != null ? category : "greenfield");

        if (frame.get(ARTIFACT_TYPE) == null) {
            return new IntakeClassification(
                    null,
                    "What type of software do you want to build? (e.g., web app, mobile app, API)",
                    frame);
        }
        if (frame.get(AUDIENCE) == null) {
            return new IntakeClassification(
                    null,
                    "Who will use this? (e.g., internal team, customers, students, general public)",
                    frame);
        }
        String outcome =
                allowedOutcomes.isEmpty() || allowedOutcomes.contains(QUALIFIED)
                        ? QUALIFIED
                        : allowedOutcomes.get(0);
        return new IntakeClassification(outcome, null, frame);
    }

    private static String firstMatch(Map<Pattern, String> patterns, String text) {
        for (Map.Entry<Pattern, String> entry : patterns.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return entry.getValue();
            }
        }
        return null;
    }
}
