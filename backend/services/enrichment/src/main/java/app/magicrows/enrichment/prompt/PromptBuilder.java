package app.magicrows.enrichment.prompt;

import app.magicrows.enrichment.domain.OutputSpecification;
import app.magicrows.enrichment.error.TemplateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class PromptBuilder {

    private static final Logger log = LoggerFactory.getLogger(PromptBuilder.class);

    public static final String VAR_TARGET_COLUMN = "target_column_name";
    public static final String VAR_OUTPUT_TYPE = "output_type";
    public static final String VAR_INCLUDE_REASONING = "include_reasoning";
    public static final String MISSING_VALUE = "None";

    private final OutputSpecification output;
    private final List<String> contextColumns;
    private final boolean includeReasoning;
    private final PromptTemplate template;
    private final TemplateException compileError;

    public PromptBuilder(OutputSpecification output, List<String> contextColumns, boolean includeReasoning) {
        this.output = output;
        this.contextColumns = List.copyOf(contextColumns);
        this.includeReasoning = includeReasoning;
        PromptTemplate compiled = null;
        TemplateException error = null;
        try {
            compiled = PromptTemplate.compile(output.prompt());
        } catch (TemplateException ex) {
            log.error("Invalid prompt template output={} error={}", output.name(), ex.getMessage());
            error = ex;
        }
        this.template = compiled;
        this.compileError = error;
    }

    public String build(Map<String, ?> row, int rowIndex) {
        if (compileError != null) {
            throw new TemplateException(
                    "Invalid prompt template for output '" + output.name() + "': " + compileError.getMessage(),
                    compileError
            );
        }
        Map<String, Object> context = new HashMap<>();
        for (String column : contextColumns) {
            if (row != null && row.containsKey(column)) {
                context.put(column, row.get(column));
            } else {
                log.warn("Context column missing rowIndex={} output={} column={}", rowIndex, output.name(), column);
                context.put(column, MISSING_VALUE);
            }
        }
        context.put(VAR_TARGET_COLUMN, output.name());
        context.put(VAR_OUTPUT_TYPE, output.type().value());
        context.put(VAR_INCLUDE_REASONING, includeReasoning);
        try {
            String prompt = template.render(context);
            if (log.isDebugEnabled()) {
                log.debug("Rendered prompt rowIndex={} output={} prompt={}", rowIndex, output.name(), abbreviate(prompt));
            }
            return prompt;
        } catch (TemplateException ex) {
            throw new TemplateException(
                    "Prompt rendering failed for output '" + output.name() + "' at row " + rowIndex + ": " + ex.getMessage(),
                    ex
            );
        }
    }

    private String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }
}
