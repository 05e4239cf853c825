package in.co.jathakam;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import in.co.jathakam.handlers.ChartHandler;
import in.co.jathakam.pojos.ErrorKind;
import in.co.jathakam.pojos.RequestBody;
import in.co.jathakam.pojos.RequestEvent;
import in.co.jathakam.rest.ApiResponse;
import in.co.jathakam.rest.RestRouter;
import in.co.jathakam.services.ChartService;
import in.co.jathakam.services.LoggingService;

import java.util.LinkedHashMap;
import java.util.Map;

public class Handler implements RequestHandler<RequestEvent, Object> {

    Gson gson = (new GsonBuilder()).setPrettyPrinting().create();
    private final ChartHandler chartHandler;
    private final RestRouter restRouter;

    public Handler() {
        this(new ChartService());
    }

    public Handler(ChartService chartService) {
        this.chartHandler = new ChartHandler(chartService);
        this.restRouter = new RestRouter(chartHandler);
    }

    @Override
    public Object handleRequest(RequestEvent event, Context context) {
        LambdaLogger logger = context.getLogger();
        LoggingService.initRequest(context);
        try {
            if ("aws.events".equals(event.getSource())) {
                logger.log("warmed up\n");
                return "Warmed up!";
            }

            String path = event.getPath();
            if (RestRouter.isRestPath(path)) {
                return handleRest(event, path).toLambdaResponse();
            }

            RequestBody requestBody = parseBody(event.getBody());
            if (requestBody == null || requestBody.getFunction() == null) {
                return errorJson(ErrorKind.INVALID_INPUT, "Missing function");
            }
            String function = requestBody.getFunction();
            LoggingService.setFunction(function);

            if (ChartHandler.handles(function)) {
                return chartHandler.handleRequest(function, requestBody);
            }
            LoggingService.warn("unknown_function", LoggingService.data("function", function));
            return errorJson(ErrorKind.INVALID_INPUT, "Unknown function: " + function);
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_malformed", LoggingService.data("error", e.getMessage()));
            return errorJson(ErrorKind.INVALID_INPUT, "Malformed request body");
        } catch (RuntimeException e) {
            LoggingService.error("handler_exception", e);
            Map<String, Object> response = new LinkedHashMap<>();
            response.put("success", false);
            response.put("errorMessage", "Internal server error");
            return gson.toJson(response);
        } finally {
            LoggingService.clearContext();
        }
    }

    private ApiResponse handleRest(RequestEvent event, String path) {
        RequestBody requestBody;
        try {
            requestBody = parseBody(event.getBody());
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_malformed", LoggingService.data("error", e.getMessage()));
            return ApiResponse.badRequestMessage(ErrorKind.INVALID_INPUT.name(), "Malformed request body");
        }
        ApiResponse response = restRouter.route(event.getHttpMethod(), path, event.getRawQueryString(), requestBody);
        if (response == null) {
            return ApiResponse.notFoundMessage("No route for " + event.getHttpMethod() + " " + path);
        }
        return response;
    }

    private RequestBody parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        return gson.fromJson(body, RequestBody.class);
    }

    private String errorJson(ErrorKind kind, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", false);
        response.put("errorCode", kind.name());
        response.put("errorMessage", message);
        return gson.toJson(response);
    }
}
