package io.github.cyfko.surveylogic.core.utils;

import io.github.cyfko.surveylogic.core.model.SurveyReport;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link SurveyReport} as a plain-text summary for consoles and log files.
 * <p>
 * Sections, in order: basic metrics, variable analysis, graph structure, expression
 * complexity, coverage metrics, transition metrics and warnings. Numbers are formatted
 * with {@link Locale#ROOT}; lines end with {@code '\n'}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ReportFormatter {

    private static final String RULE = "=".repeat(70);

    private ReportFormatter() {}

    public static String format(SurveyReport report) {
        Objects.requireNonNull(report, "Report cannot be null");
        StringBuilder out = new StringBuilder();

        out.append(RULE).append('\n');
        out.append("SURVEY ANALYSIS REPORT: ").append(report.surveyName()).append('\n');
        out.append(RULE).append("\n\n");

        out.append("BASIC METRICS\n");
        line(out, "Total States", report.totalStates());
        line(out, "Total Transitions", report.totalTransitions());
        line(out, "Total Variables", report.totalVariables());
        line(out, "Total Blocks", report.totalBlocks());
        out.append('\n');

        out.append("VARIABLE ANALYSIS\n");
        line(out, "Undefined Variables", report.undefinedVariables().size());
        if (!report.undefinedVariables().isEmpty()) {
            out.append("    ").append(join(report.undefinedVariables())).append('\n');
        }
        line(out, "Unused Variables", report.unusedVariables().size());
        if (!report.unusedVariables().isEmpty()) {
            out.append("    ").append(join(report.unusedVariables())).append('\n');
        }
        if (!report.variableUsage().isEmpty()) {
            out.append("  Variable Usage:\n");
            for (Map.Entry<String, Integer> e : report.variableUsage().entrySet()) {
                out.append("    ").append(e.getKey()).append(": ")
                        .append(e.getValue()).append(" reference(s)\n");
            }
        }
        out.append('\n');

        out.append("GRAPH STRUCTURE\n");
        line(out, "Entry Points", joinOrNone(report.entryPoints()));
        line(out, "Exit Points", joinOrNone(report.exitPoints()));
        line(out, "Unreachable States", joinOrNone(report.unreachableStates()));
        line(out, "Has Cycles", report.hasCycles() ? "YES" : "NO");
        if (report.hasCycles()) {
            out.append("    Example: ").append(String.join(" -> ", report.exampleCycle())).append('\n');
        }
        out.append('\n');

        out.append("EXPRESSION COMPLEXITY\n");
        line(out, "Max Expression Depth", report.maxExpressionDepth());
        line(out, "Avg Expression Depth", String.format(Locale.ROOT, "%.2f", report.avgExpressionDepth()));
        line(out, "Total Expression Nodes", report.totalExpressionNodes());
        out.append('\n');

        out.append("COVERAGE METRICS\n");
        line(out, "States with Guard", report.statesWithEntryGuard() + "/" + report.totalStates());
        line(out, "States with Validation", report.statesWithValidation() + "/" + report.totalStates());
        line(out, "Validation Coverage",
                String.format(Locale.ROOT, "%.1f%%", report.validationCoveragePercent()));
        line(out, "States with Version", report.statesWithVersion() + "/" + report.totalStates());
        out.append('\n');

        out.append("TRANSITION METRICS\n");
        line(out, "Max Transitions/State", report.maxTransitionsPerState());
        line(out, "Avg Transitions/State",
                String.format(Locale.ROOT, "%.2f", report.avgTransitionsPerState()));
        out.append('\n');

        if (report.hasWarnings()) {
            out.append("WARNINGS\n");
            List<String> messages = report.warningMessages();
            for (int i = 0; i < messages.size(); i++) {
                out.append("  ").append(i + 1).append(". ").append(messages.get(i)).append('\n');
            }
        } else {
            out.append("NO WARNINGS\n");
        }

        return out.toString();
    }

    private static void line(StringBuilder out, String label, Object value) {
        out.append(String.format(Locale.ROOT, "  %-24s%s", label + ":", value)).append('\n');
    }

    private static String join(Collection<String> names) {
        return String.join(", ", names);
    }

    private static String joinOrNone(Collection<String> names) {
        return names.isEmpty() ? "None" : join(names);
    }
}
