package com.shipdata.inference;

import com.shipdata.model.ColumnType;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects type candidates for one column across a full scan and resolves them into a single
 * storage type.
 *
 * <p>Reconciliation rules:
 * <ul>
 *     <li>integer and big-integer widen to big-integer</li>
 *     <li>any integral type mixed with double widens to double</li>
 *     <li>date mixed with timestamp widens to timestamp</li>
 *     <li>every other mix falls back to string with a warning</li>
 * </ul>
 */
public class ColumnTypeAccumulator {

    private static final Set<ColumnType> NUMERIC = EnumSet.of(ColumnType.INTEGER, ColumnType.BIG_INTEGER, ColumnType.DOUBLE);
    private static final Set<ColumnType> TEMPORAL = EnumSet.of(ColumnType.DATE, ColumnType.TIMESTAMP);

    private final String columnName;
    private final EnumSet<ColumnType> seen = EnumSet.noneOf(ColumnType.class);

    private String monthFirstExample;
    private String dayFirstExample;
    private TypeInference.DatePartEvidence ambiguousExample;
    private String ambiguousRaw;

    public ColumnTypeAccumulator(String columnName) {
        this.columnName = columnName;
    }

    /**
     * Observe a raw text value.
     *
     * @param raw raw text, blanks are ignored
     */
    public void observe(String raw) {
        ColumnType candidate = TypeInference.classify(raw);
        if (candidate == null) {
            return;
        }
        seen.add(candidate);
        if (candidate == ColumnType.DATE) {
            recordDateEvidence(raw.trim());
        }
    }

    /**
     * Observe a value whose type is already known, such as a typed spreadsheet cell.
     *
     * @param candidate type candidate, null for an empty cell
     */
    public void observeTyped(ColumnType candidate) {
        if (candidate != null) {
            seen.add(candidate);
        }
    }

    private void recordDateEvidence(String value) {
        TypeInference.DatePartEvidence evidence = TypeInference.datePartEvidence(value);
        if (evidence == null) {
            return;
        }
        if (evidence.isAmbiguous()) {
            if (ambiguousExample == null) {
                ambiguousExample = evidence;
                ambiguousRaw = value;
            }
        } else if (evidence.monthFirst() != null && evidence.dayFirst() == null) {
            if (monthFirstExample == null) {
                monthFirstExample = value;
            }
        } else if (evidence.dayFirst() != null && evidence.monthFirst() == null) {
            if (dayFirstExample == null) {
                dayFirstExample = value;
            }
        }
    }

    public InferredColumn resolve() {
        List<String> warnings = new ArrayList<>();

        if (seen.isEmpty()) {
            return new InferredColumn(columnName, ColumnType.STRING, DateOrder.MONTH_FIRST, warnings);
        }

        ColumnType resolved = reconcile();
        if (resolved == null) {
            warnings.add(String.format("Column '%s' has mixed value types (%s); imported as string",
                    columnName, describeSeen()));
            return new InferredColumn(columnName, ColumnType.STRING, DateOrder.MONTH_FIRST, warnings);
        }

        DateOrder order = DateOrder.MONTH_FIRST;
        if (TEMPORAL.contains(resolved)) {
            if (monthFirstExample != null && dayFirstExample != null) {
                warnings.add(String.format(
                        "Column '%s' mixes US (MM/DD) and EU (DD/MM) dates ('%s' vs '%s'); imported as string",
                        columnName, monthFirstExample, dayFirstExample));
                return new InferredColumn(columnName, ColumnType.STRING, DateOrder.MONTH_FIRST, warnings);
            }
            if (dayFirstExample != null) {
                order = DateOrder.DAY_FIRST;
            } else if (monthFirstExample == null && ambiguousExample != null) {
                warnings.add(String.format("Column '%s': Date '%s' could be %s (US) or %s (EU). Using US format.",
                        columnName,
                        ambiguousRaw,
                        TypeInference.display(ambiguousExample.monthFirst()),
                        TypeInference.display(ambiguousExample.dayFirst())));
            }
        }
        return new InferredColumn(columnName, resolved, order, warnings);
    }

    private ColumnType reconcile() {
        if (seen.size() == 1) {
            return seen.iterator().next();
        }
        if (seen.contains(ColumnType.STRING)) {
            return null;
        }
        if (NUMERIC.containsAll(seen)) {
            if (seen.contains(ColumnType.DOUBLE)) {
                return ColumnType.DOUBLE;
            }
            return ColumnType.BIG_INTEGER;
        }
        if (TEMPORAL.containsAll(seen)) {
            return ColumnType.TIMESTAMP;
        }
        return null;
    }

    private String describeSeen() {
        return seen.stream().map(ColumnType::getWireName).collect(Collectors.joining(", "));
    }

    public String getColumnName() {
        return columnName;
    }
}
