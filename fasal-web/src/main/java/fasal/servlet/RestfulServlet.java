package fasal.servlet;

import cn.hutool.core.convert.Convert;
import cn.hutool.core.util.StrUtil;
import fasal.common.exception.ModelUnavailableException;
import fasal.common.exception.RRException;
import fasal.common.exception.UnknownLabelException;
import fasal.common.exception.ValidationException;
import fasal.response.RestfulResponse;
import fasal.servlet.annotation.Get;
import fasal.servlet.annotation.Param;
import fasal.servlet.annotation.Post;
import lombok.extern.slf4j.Slf4j;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatches {@code /prefix/*} requests to methods annotated with {@link Get} or {@link Post}.
 * Non-void return values are wrapped in a {@link RestfulResponse}; {@link RRException}s become
 * error responses carrying the exception code as HTTP status.
 */
@Slf4j
public class RestfulServlet extends BaseServlet {

    private static final long serialVersionUID = 1L;
    static final String INTERNAL_ERROR = "Internal server error, please contact the administrator";

    private final Map<String, Method> registerGetMethod = new ConcurrentHashMap<>();
    private final Map<String, Method> registerPostMethod = new ConcurrentHashMap<>();

    @Override
    public void init() throws ServletException {
        super.init();
        for (Method method : this.getClass().getDeclaredMethods()) {
            if (method.isAnnotationPresent(Get.class)) {
                registerGetMethod.put(normalizePath(method.getAnnotation(Get.class).value()), method);
            } else if (method.isAnnotationPresent(Post.class)) {
                registerPostMethod.put(normalizePath(method.getAnnotation(Post.class).value()), method);
            }
        }
    }

    private static String normalizePath(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    private void doRequest(HttpServletRequest req, HttpServletResponse resp, Map<String, Method> map)
            throws ServletException, IOException {
        req.setCharacterEncoding("UTF-8");
        resp.setHeader("Content-Type", "application/json;charset=utf-8");

        String pathInfo = req.getPathInfo();
        Method mth = map.get(pathInfo == null ? "/" : normalizePath(pathInfo));
        if (mth == null) {
            resp.sendError(HttpServletResponse.SC_NOT_FOUND);
            return;
        }
        try {
            Object o = mth.invoke(this, parseParams(req, resp, mth.getParameters()));
            if (!mth.getReturnType().equals(Void.TYPE)) {
                responsePrint(resp, toJson(RestfulResponse.succeeded(o)));
            }
        } catch (IllegalAccessException | IllegalArgumentException e) {
            log.error("Cannot invoke handler {}", mth.getName(), e);
            writeError(resp, RestfulResponse.error(INTERNAL_ERROR));
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ServletException) {
                throw (ServletException) cause;
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            writeError(resp, toErrorResponse(cause));
        }
    }

    /**
     * Maps a handler failure onto the response body. Integrity faults and unexpected errors
     * never leak their message.
     */
    static RestfulResponse<Object> toErrorResponse(Throwable cause) {
        if (cause instanceof ModelUnavailableException) {
            ModelUnavailableException e = (ModelUnavailableException) cause;
            return RestfulResponse.error(e.getCode(), e.getMsg(), e.getFallbackResponse());
        }
        if (cause instanceof ValidationException) {
            ValidationException e = (ValidationException) cause;
            return RestfulResponse.error(e.getCode(), e.getReason().getCode() + ": " + e.getMsg());
        }
        if (cause instanceof UnknownLabelException) {
            return RestfulResponse.error(500, INTERNAL_ERROR);
        }
        if (cause instanceof RRException) {
            RRException e = (RRException) cause;
            return RestfulResponse.error(e.getCode(), e.getMsg());
        }
        if (cause instanceof CancellationException) {
            return RestfulResponse.error(503, "Request cancelled");
        }
        log.error("Unhandled servlet error", cause);
        return RestfulResponse.error(500, INTERNAL_ERROR);
    }

    protected void writeError(HttpServletResponse resp, RestfulResponse<?> error) throws IOException {
        Integer code = error.getCode();
        if (code != null && code >= 400 && code < 600) {
            resp.setStatus(code);
        } else {
            resp.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
        }
        responsePrint(resp, toJson(error));
    }

    private Object[] parseParams(HttpServletRequest req, HttpServletResponse resp, Parameter[] params) {
        Object[] values = new Object[params.length];
        for (int i = 0; i < params.length; i++) {
            Parameter param = params[i];
            if (param.getType() == HttpServletRequest.class) {
                values[i] = req;
            } else if (param.getType() == HttpServletResponse.class) {
                values[i] = resp;
            } else if (param.isAnnotationPresent(Param.class)) {
                Param p = param.getAnnotation(Param.class);
                String value = req.getParameter(p.value());
                if (StrUtil.isBlank(value)) {
                    value = p.def();
                }
                values[i] = convertQuery(value, param.getType());
            }
        }
        return values;
    }

    private static Object convertQuery(String value, Class<?> type) {
        if (value == null) {
            return null;
        }
        if (type == String.class) {
            return value;
        }
        return Convert.convert(type, value, null);
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        doRequest(req, resp, registerGetMethod);
    }

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        doRequest(req, resp, registerPostMethod);
    }
}
