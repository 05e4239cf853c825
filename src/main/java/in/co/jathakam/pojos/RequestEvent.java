package in.co.jathakam.pojos;

/**
 * Incoming Lambda event. Function URL invocations carry {@code rawPath} and a JSON {@code body};
 * EventBridge warm-up pings only set {@code source}.
 */
public class RequestEvent {
    private RequestContext requestContext;
    private String source;
    private String rawPath;
    private String rawQueryString;
    private String body;

    public RequestEvent() {
    }

    public RequestContext getRequestContext() {
        return requestContext;
    }

    public void setRequestContext(RequestContext requestContext) {
        this.requestContext = requestContext;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getRawPath() {
        return rawPath;
    }

    public void setRawPath(String rawPath) {
        this.rawPath = rawPath;
    }

    public String getRawQueryString() {
        return rawQueryString;
    }

    public void setRawQueryString(String rawQueryString) {
        this.rawQueryString = rawQueryString;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    /** HTTP method from the request context, or null for non-HTTP events. */
    public String getHttpMethod() {
        if (requestContext == null || requestContext.getHttp() == null) {
            return null;
        }
        return requestContext.getHttp().getMethod();
    }

    /** Request path, preferring {@code rawPath} over {@code requestContext.http.path}. */
    public String getPath() {
        if (rawPath != null) {
            return rawPath;
        }
        if (requestContext == null || requestContext.getHttp() == null) {
            return null;
        }
        return requestContext.getHttp().getPath();
    }
}
