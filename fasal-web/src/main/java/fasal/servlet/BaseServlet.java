package fasal.servlet;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;

public class BaseServlet extends HttpServlet {
    private static final long serialVersionUID = 1L;

    protected final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

    protected String toJson(Object object) {
        return gson.toJson(object);
    }

    protected void responsePrint(HttpServletResponse resp, String content) throws IOException {
        resp.setCharacterEncoding("UTF-8");
        PrintWriter out = resp.getWriter();
        out.print(content);
        out.flush();
    }

    protected <T> T reqBodyToObj(HttpServletRequest req, Class<T> clazz) throws IOException {
        StringBuilder body = new StringBuilder();
        try (BufferedReader reader = req.getReader()) {
            String line;
            while ((line = reader.readLine()) != null) {
                body.append(line);
            }
        }
        return gson.fromJson(body.toString(), clazz);
    }
}
