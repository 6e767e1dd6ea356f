package com.serialgen.generator.cli.output;

import lombok.Builder;
import lombok.Value;

/**
 * One node of a described element tree.
 */
@Value
@Builder
public class ReportRow {
    int depth;
    String indent;
    String kind;
    String varname;
    String typeName;
    String zeroExpr;
    String ifZeroExpr;
    int complexity;
    boolean allowsNil;
    boolean resolved;
    String note;
}
