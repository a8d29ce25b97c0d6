package org.modcat.output.notebook;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Wraps an assembled artifact into a Jupyter notebook document (nbformat 4.4).
 *
 * <p>Three cells: a markdown title, one code cell holding the artifact unchanged (split into lines that
 * keep their terminators), and a markdown cell repeating the banner in a fenced block.</p>
 */
public final class NotebookWriter {

    static final int NBFORMAT = 4;
    static final int NBFORMAT_MINOR = 4;

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    /**
     * Serializes the notebook.
     *
     * @param title       Text of the leading markdown cell.
     * @param code        The assembled artifact.
     * @param bannerLines Lines of the trailing markdown cell.
     * @return The notebook JSON.
     */
    public String toJson(String title, String code, List<String> bannerLines) {
        List<String> trailer = new ArrayList<>();
        trailer.add("```\n");
        for (String line : bannerLines) {
            trailer.add(line + "\n");
        }
        trailer.add("```\n");

        Map<String, Object> codeCell = new LinkedHashMap<>();
        codeCell.put("cell_type", "code");
        codeCell.put("metadata", Map.of());
        codeCell.put("source", splitLinesKeepEnds(code));
        codeCell.put("execution_count", null);
        codeCell.put("outputs", List.of());

        Map<String, Object> kernelspec = new LinkedHashMap<>();
        kernelspec.put("display_name", "Python 3");
        kernelspec.put("language", "python");
        kernelspec.put("name", "python3");

        Map<String, Object> notebook = new LinkedHashMap<>();
        notebook.put("cells", List.of(markdownCell(List.of(title + "\n")), codeCell, markdownCell(trailer)));
        notebook.put("metadata", Map.of("kernelspec", kernelspec));
        notebook.put("nbformat", NBFORMAT);
        notebook.put("nbformat_minor", NBFORMAT_MINOR);
        return gson.toJson(notebook);
    }

    /**
     * Splits text into lines, each keeping its {@code \n}. A final line without terminator is kept as is.
     */
    static List<String> splitLinesKeepEnds(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = text.indexOf('\n', start);
            if (end < 0) {
                lines.add(text.substring(start));
                break;
            }
            lines.add(text.substring(start, end + 1));
            start = end + 1;
        }
        return lines;
    }

    private static Map<String, Object> markdownCell(List<String> source) {
        Map<String, Object> cell = new LinkedHashMap<>();
        cell.put("cell_type", "markdown");
        cell.put("metadata", Map.of());
        cell.put("source", source);
        return cell;
    }
}
