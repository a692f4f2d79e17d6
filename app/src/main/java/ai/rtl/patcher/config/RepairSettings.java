package ai.rtl.patcher.config;

/**
 * Tunable tolerances of the repair heuristics.
 *
 * @param elseLookahead            lines after an {@code if} block's end within which an {@code else} may still pair
 * @param sequentialProbeRadius    lines around an always header searched for non-blocking assignments
 * @param clockDeclarationScanLines leading lines searched for a clock input declaration
 * @param clockEdgeScanLines       leading lines searched for an existing clock edge
 * @param parameterScanLines       leading lines searched for a loop-bound parameter
 * @param defaultLoopBound         generate loop bound used when no parameter qualifies
 */
public record RepairSettings(
        int elseLookahead,
        int sequentialProbeRadius,
        int clockDeclarationScanLines,
        int clockEdgeScanLines,
        int parameterScanLines,
        int defaultLoopBound
) {

    public static final int DEFAULT_ELSE_LOOKAHEAD = 5;
    public static final int DEFAULT_SEQUENTIAL_PROBE_RADIUS = 5;
    public static final int DEFAULT_CLOCK_DECLARATION_SCAN_LINES = 50;
    public static final int DEFAULT_CLOCK_EDGE_SCAN_LINES = 100;
    public static final int DEFAULT_PARAMETER_SCAN_LINES = 100;
    public static final int DEFAULT_LOOP_BOUND = 8;

    public RepairSettings {
        requirePositive(elseLookahead, "elseLookahead");
        requirePositive(sequentialProbeRadius, "sequentialProbeRadius");
        requirePositive(clockDeclarationScanLines, "clockDeclarationScanLines");
        requirePositive(clockEdgeScanLines, "clockEdgeScanLines");
        requirePositive(parameterScanLines, "parameterScanLines");
        requirePositive(defaultLoopBound, "defaultLoopBound");
    }

    public static RepairSettings defaults() {
        return new RepairSettings(DEFAULT_ELSE_LOOKAHEAD, DEFAULT_SEQUENTIAL_PROBE_RADIUS,
                DEFAULT_CLOCK_DECLARATION_SCAN_LINES, DEFAULT_CLOCK_EDGE_SCAN_LINES, DEFAULT_PARAMETER_SCAN_LINES,
                DEFAULT_LOOP_BOUND);
    }

    public RepairSettings withElseLookahead(int value) {
        return new RepairSettings(value, sequentialProbeRadius, clockDeclarationScanLines, clockEdgeScanLines,
                parameterScanLines, defaultLoopBound);
    }

    public RepairSettings withSequentialProbeRadius(int value) {
        return new RepairSettings(elseLookahead, value, clockDeclarationScanLines, clockEdgeScanLines,
                parameterScanLines, defaultLoopBound);
    }

    public RepairSettings withDefaultLoopBound(int value) {
        return new RepairSettings(elseLookahead, sequentialProbeRadius, clockDeclarationScanLines, clockEdgeScanLines,
                parameterScanLines, value);
    }

    private static void requirePositive(int value, String fieldName) {
        if (value <= 0) {
            throw new IllegalArgumentException(fieldName + " must be greater than zero");
        }
    }
}
