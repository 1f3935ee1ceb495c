package fasal.utils;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Map.Entry;

public class HttpUtil {

    private static Logger logger = LoggerFactory.getLogger(HttpUtil.class);

    /**
     * Posts a JSON body and returns the response body of a 200 reply.
     *
     * @throws IOException on network failure, timeout or any other status code
     */
    public static String httpPost(String url, Map<String, String> headers, String json, int timeout) throws IOException {
        if (url == null) {
            throw new IOException("No url given");
        }
        CloseableHttpClient httpClient;
        if (timeout < 0) {
            httpClient = HttpClientBuilder.create().build();
        } else {
            RequestConfig config = RequestConfig.custom().setConnectTimeout(timeout).setConnectionRequestTimeout(timeout).setSocketTimeout(timeout).build();
            httpClient = HttpClientBuilder.create().setDefaultRequestConfig(config).build();
        }

        HttpPost httpPost = new HttpPost(url);
        Map<String, String> safeHeaders = headers == null ? Collections.emptyMap() : headers;
        for (Entry<String, String> entry : safeHeaders.entrySet()) {
            httpPost.setHeader(entry.getKey(), entry.getValue());
        }
        httpPost.setEntity(new StringEntity(json, ContentType.APPLICATION_JSON));
        try (CloseableHttpClient client = httpClient;
             CloseableHttpResponse response = client.execute(httpPost)) {
            int statusCode = response.getStatusLine().getStatusCode();
            String message = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), "UTF-8");
            if (statusCode != 200) {
                logger.info("Http Post " + url + " statusCode = " + statusCode + " response: " + message);
                throw new IOException("Http Post " + url + " returned status " + statusCode);
            }
            return message;
        }
    }
}
