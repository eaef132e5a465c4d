package sitesearch;

import java.util.List;

// Plain text of a page plus its raw href values, in document order.
public record ParsedPage(String text, List<String> hrefs) {

    public ParsedPage {
        text = text == null ? "" : text;
        hrefs = hrefs == null ? List.of() : List.copyOf(hrefs);
    }
}
