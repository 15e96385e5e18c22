package org.nowstart.tradecore.strategy.core;

/**
 * One explainability value attached to a {@link org.nowstart.tradecore.data.dto.TradingSignal}.
 *
 * <p>Diagnostics carry audit data such as regime sub-scores, gate inputs and per-indicator scores. They never
 * drive execution.
 *
 * <p>Key conventions:
 * <ul>
 *   <li>Use stable machine-readable keys (for example {@code regime.trend}, {@code gate.volatility}).</li>
 *   <li>{@code label} is display-friendly text; {@code key} is the grouping identifier.</li>
 *   <li>Use {@code unit} only for numeric values.</li>
 * </ul>
 *
 * @param key         stable diagnostic identifier
 * @param label       human-readable name
 * @param type        expected value type
 * @param unit        value unit (numeric diagnostics only)
 * @param description optional short explanation
 * @param value       actual diagnostic value
 */
public record StrategyDiagnostic(
        String key,
        String label,
        StrategyDiagnosticType type,
        String unit,
        String description,
        Object value
) {

    public StrategyDiagnostic {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("diagnostic key is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("diagnostic type is required");
        }
        if (value == null) {
            throw new IllegalArgumentException("diagnostic value is required");
        }
        label = (label == null || label.isBlank()) ? key : label;
        unit = unit == null ? "" : unit;
        description = description == null ? "" : description;
        if (!type.supports(value)) {
            throw new IllegalArgumentException("diagnostic " + key + " must be " + type.typeName());
        }
    }

    public static StrategyDiagnostic number(String key, String label, String unit, String description, double value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.NUMBER, unit, description, value);
    }

    public static StrategyDiagnostic bool(String key, String label, String description, boolean value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.BOOLEAN, "", description, value);
    }

    public static StrategyDiagnostic text(String key, String label, String description, String value) {
        return new StrategyDiagnostic(key, label, StrategyDiagnosticType.STRING, "", description, value == null ? "" : value);
    }
}
