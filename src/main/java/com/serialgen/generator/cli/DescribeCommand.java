package com.serialgen.generator.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.serialgen.generator.cli.output.ReportRow;
import com.serialgen.generator.cli.output.TreeReportPrinter;
import com.serialgen.generator.config.GeneratorConfig;
import com.serialgen.generator.model.Elem;
import com.serialgen.generator.model.ShimMode;
import com.serialgen.generator.naming.IdentifierGenerator;
import com.serialgen.generator.naming.IdentifierSpaceExhaustedException;
import com.serialgen.generator.parser.TypeDirectives;
import com.serialgen.generator.parser.TypeExpressionParser;
import com.serialgen.generator.parser.exception.TypeExpressionException;

import freemarker.template.TemplateException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Parses one type expression, runs the naming pass and prints what the
 * emitter would read from every node.
 */
@Command(
        name = "describe",
        mixinStandardHelpOptions = true,
        version = "serialgen-elem 1.0.0",
        description = "Builds the element tree of a type expression and prints its access paths, type names and zero values."
)
public class DescribeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DescribeCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "TYPE", description = "Type expression, e.g. 'map[string][]*float64'")
    private String expression;

    @Option(names = {"--root", "-r"}, defaultValue = "z", description = "Receiver expression the root is bound to (default: z)")
    private String root;

    @Option(names = {"--prefix", "-p"}, defaultValue = IdentifierGenerator.DEFAULT_PREFIX, description = "Prefix of generated index names (default: za)")
    private String prefix;

    @Option(names = {"--shim"}, paramLabel = "NAME=BASE[:TO[:FROM]]", description = "Serialize NAME as the primitive BASE through conversion functions")
    private Map<String, String> shims = new LinkedHashMap<>();

    @Option(names = {"--convert"}, description = "Shims use explicit conversion functions instead of casts")
    private boolean convertShims;

    @Option(names = {"--replace"}, paramLabel = "NAME=TYPE", description = "Serialize NAME as another type expression")
    private Map<String, String> replacements = new LinkedHashMap<>();

    @Option(names = {"--verbose", "-v"}, description = "Show binding names and conversions")
    private boolean verbose;

    @Override
    public Integer call() {
        GeneratorConfig config = GeneratorConfig.builder()
                .rootVarname(root)
                .identPrefix(prefix)
                .verbose(verbose)
                .build();

        try {
            TypeDirectives directives = buildDirectives();
            Elem elem = TypeExpressionParser.parse(expression, directives);

            IdentifierGenerator identifiers = IdentifierGenerator.fromConfig(config);
            elem.bindName(config.getRootVarname(), identifiers);
            log.debug("Bound {} with {} generated names", expression, identifiers.getAllocated());

            TreeReportPrinter printer = new TreeReportPrinter(config.isVerbose());
            List<ReportRow> rows = printer.collect(elem);
            PrintWriter out = spec.commandLine().getOut();
            printer.render(expression, rows, out);

            List<ReportRow> unresolved = rows.stream().filter(r -> !r.isResolved()).toList();
            for (ReportRow row : unresolved) {
                log.error("Type {} at {} does not provide the serialization methods", row.getTypeName(), row.getVarname());
            }
            return unresolved.isEmpty() ? 0 : 1;

        } catch (TypeExpressionException e) {
            log.error("Invalid type expression '{}': {}", expression, e.getMessage());
            return 1;
        } catch (IdentifierSpaceExhaustedException e) {
            log.error("Naming failed: {}", e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            log.error("Invalid directive: {}", e.getMessage());
            return 1;
        } catch (IOException | TemplateException e) {
            log.error("Failed to render report", e);
            return 1;
        }
    }

    private TypeDirectives buildDirectives() {
        TypeDirectives directives = new TypeDirectives();
        ShimMode mode = convertShims ? ShimMode.CONVERT : ShimMode.CAST;
        shims.forEach((name, target) -> {
            String[] parts = target.split(":", -1);
            String toBase = parts.length > 1 && !parts[1].isEmpty() ? parts[1] : null;
            String fromBase = parts.length > 2 && !parts[2].isEmpty() ? parts[2] : null;
            directives.shim(name, parts[0], toBase, fromBase, mode);
        });
        replacements.forEach(directives::replace);
        return directives;
    }
}
