package org.modcat.output.notebook;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NotebookWriterTest {

    private final NotebookWriter writer = new NotebookWriter();

    @Test
    @Tag("unit")
    void writesThreeCellNotebook() {
        String code = "# Generated by modcat\nimport os\n\nprint('<ok>')";

        JsonObject notebook = JsonParser.parseString(
                writer.toJson("## Title", code, List.of("# Generated by modcat", "# v1"))).getAsJsonObject();

        assertThat(notebook.get("nbformat").getAsInt()).isEqualTo(4);
        assertThat(notebook.get("nbformat_minor").getAsInt()).isEqualTo(4);
        assertThat(notebook.getAsJsonObject("metadata").getAsJsonObject("kernelspec").get("name").getAsString())
                .isEqualTo("python3");

        JsonArray cells = notebook.getAsJsonArray("cells");
        assertThat(cells).hasSize(3);
        assertThat(cells.get(0).getAsJsonObject().get("cell_type").getAsString()).isEqualTo("markdown");
        assertThat(join(cells.get(0).getAsJsonObject().getAsJsonArray("source"))).isEqualTo("## Title\n");

        JsonObject codeCell = cells.get(1).getAsJsonObject();
        assertThat(codeCell.get("cell_type").getAsString()).isEqualTo("code");
        assertThat(codeCell.get("execution_count").isJsonNull()).isTrue();
        assertThat(codeCell.getAsJsonArray("outputs")).isEmpty();
        assertThat(join(codeCell.getAsJsonArray("source"))).isEqualTo(code);

        assertThat(join(cells.get(2).getAsJsonObject().getAsJsonArray("source")))
                .isEqualTo("```\n# Generated by modcat\n# v1\n```\n");
    }

    @Test
    @Tag("unit")
    void splitsLinesKeepingTerminators() {
        assertThat(NotebookWriter.splitLinesKeepEnds("a\nb")).containsExactly("a\n", "b");
        assertThat(NotebookWriter.splitLinesKeepEnds("a\n\n")).containsExactly("a\n", "\n");
        assertThat(NotebookWriter.splitLinesKeepEnds("")).isEmpty();
    }

    private static String join(JsonArray lines) {
        StringBuilder out = new StringBuilder();
        for (JsonElement line : lines) {
            out.append(line.getAsString());
        }
        return out.toString();
    }
}
