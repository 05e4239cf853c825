package in.co.jathakam.pojos;

/**
 * The {@code requestContext} block of a Lambda Function URL event. Supplies the HTTP method,
 * and the path when {@link RequestEvent#getRawPath()} is absent.
 */
public class RequestContext {
    private Http http;

    public RequestContext() {
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public static class Http {
        private String method;
        private String path;

        public Http() {
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }
}
