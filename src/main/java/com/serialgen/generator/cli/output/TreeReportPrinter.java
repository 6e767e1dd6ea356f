package com.serialgen.generator.cli.output;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.codegen.util.ElemUtil;
import com.serialgen.generator.model.ArrayElem;
import com.serialgen.generator.model.BaseElem;
import com.serialgen.generator.model.Elem;
import com.serialgen.generator.model.ElemVisitor;
import com.serialgen.generator.model.MapElem;
import com.serialgen.generator.model.PtrElem;
import com.serialgen.generator.model.SliceElem;
import com.serialgen.generator.model.StructElem;
import com.serialgen.generator.model.StructField;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders a bound element tree, one line per node, through the
 * {@code tree-report.ftl} template.
 */
public class TreeReportPrinter {
    private static final Logger log = LoggerFactory.getLogger(TreeReportPrinter.class);

    static final String TEMPLATE = "tree-report.ftl";

    private final Configuration freemarkerConfig;
    private final boolean verbose;

    public TreeReportPrinter(boolean verbose) {
        this.verbose = verbose;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public List<ReportRow> collect(Elem root) {
        List<ReportRow> rows = new ArrayList<>();
        root.accept(new RowCollector(rows, 0, null));
        return rows;
    }

    public void render(String expression, List<ReportRow> rows, Writer out) throws IOException, TemplateException {
        Template template = freemarkerConfig.getTemplate(TEMPLATE);
        Map<String, Object> model = new HashMap<>();
        model.put("expression", expression);
        model.put("rows", rows);
        model.put("unresolved", rows.stream().filter(r -> !r.isResolved()).count());
        template.process(model, out);
        out.flush();
        log.debug("Rendered {} nodes for {}", rows.size(), expression);
    }

    private final class RowCollector implements ElemVisitor<Void> {
        private final List<ReportRow> rows;
        private final int depth;
        private final String fieldName;

        RowCollector(List<ReportRow> rows, int depth, String fieldName) {
            this.rows = rows;
            this.depth = depth;
            this.fieldName = fieldName;
        }

        private RowCollector child(String childField) {
            return new RowCollector(rows, depth + 1, childField);
        }

        private void add(Elem elem, String kind, boolean resolved, String detail) {
            StringBuilder note = new StringBuilder();
            if (fieldName != null) {
                note.append("field ").append(fieldName);
            }
            if (!resolved) {
                append(note, "unresolved");
            }
            if (verbose && detail != null && !detail.isEmpty()) {
                append(note, detail);
            }
            rows.add(ReportRow.builder()
                    .depth(depth)
                    .indent("  ".repeat(depth))
                    .kind(kind)
                    .varname(elem.getVarname() == null ? "" : elem.getVarname())
                    .typeName(elem.typeName())
                    .zeroExpr(elem.zeroExpr())
                    .ifZeroExpr(elem.ifZeroExpr())
                    .complexity(elem.complexity())
                    .allowsNil(elem.allowsNil())
                    .resolved(resolved)
                    .note(note.toString())
                    .build());
        }

        private void append(StringBuilder note, String text) {
            if (note.length() > 0) {
                note.append(", ");
            }
            note.append(text);
        }

        @Override
        public Void visit(BaseElem base) {
            String detail = "base " + base.baseName();
            if (base.isConvert()) {
                detail += ", convert via " + base.toBase() + "/" + base.fromBase();
            }
            if (!ElemUtil.isPrintable(base)) {
                detail += ", inline";
            }
            add(base, "base", base.resolved(), detail);
            return null;
        }

        @Override
        public Void visit(PtrElem ptr) {
            add(ptr, "ptr", true, ptr.needsInit() ? "needs init" : "");
            ptr.getValue().accept(child(null));
            return null;
        }

        @Override
        public Void visit(StructElem struct) {
            add(struct, "struct", true, struct.isAsTuple() ? "tuple" : "");
            for (StructField field : struct.getFields()) {
                field.getElem().accept(child(field.getFieldName()));
            }
            return null;
        }

        @Override
        public Void visit(ArrayElem array) {
            add(array, "array", true, "index " + array.getIndex() + ", size " + ElemUtil.coerceArraySize(array.getSize()));
            array.getElem().accept(child(null));
            return null;
        }

        @Override
        public Void visit(SliceElem slice) {
            add(slice, "slice", true, "index " + slice.getIndex());
            slice.getElem().accept(child(null));
            return null;
        }

        @Override
        public Void visit(MapElem map) {
            add(map, "map", true, "key " + map.getKeyIndex() + ", value " + map.getValueIndex());
            map.getValue().accept(child(null));
            return null;
        }
    }
}
