package sitesearch;

import java.io.IOException;

// Fetches one URL. Transport problems (DNS, refused connection, timeout) surface as IOException.
public interface PageFetcher {

    FetchResponse fetch(String url) throws IOException;
}
