package sitesearch;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

public class JsoupPageParser implements PageParser {

    @Override
    public ParsedPage parse(String html) {
        Document doc = Jsoup.parse(html == null ? "" : html);

        // Raw attribute values; resolving them is the crawler's job since the base depends on scope
        List<String> hrefs = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            hrefs.add(a.attr("href"));
        }
        return new ParsedPage(doc.text(), hrefs);
    }
}
