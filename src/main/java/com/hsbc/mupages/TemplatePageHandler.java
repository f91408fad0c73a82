package com.hsbc.mupages;

import io.muserver.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

class TemplatePageHandler implements MuHandler {

    private static final Logger log = LoggerFactory.getLogger(TemplatePageHandler.class);

    private final TemplatePages pages;
    private final ContextBuilder contextBuilder;
    private final List<PageListener> pageListeners;

    TemplatePageHandler(TemplatePages pages, ContextBuilder contextBuilder, List<PageListener> pageListeners) {
        this.pages = pages;
        this.contextBuilder = contextBuilder;
        this.pageListeners = pageListeners;
    }

    @Override
    public boolean handle(MuRequest request, MuResponse response) throws Exception {
        if (request.method() != Method.GET) {
            return false;
        }

        Optional<String> matched = pages.resolveTemplate(request.uri().getRawPath());
        if (matched.isEmpty()) {
            return false;
        }

        PageInfoImpl info = new PageInfoImpl(matched.get(), request, response);
        AsyncHandle asyncHandle = request.handleAsync();

        CompletableFuture<Map<String, Object>> contextFuture;
        try {
            CompletionStage<Map<String, Object>> stage = contextBuilder.build(request);
            if (stage == null) {
                throw new IllegalStateException("The context builder returned null instead of a completion stage");
            }
            contextFuture = stage.toCompletableFuture();
        } catch (Exception e) {
            sendErrorResponse(info, asyncHandle, e);
            return true;
        }

        // the client may go away while the context is still being built
        AtomicBoolean clientGone = new AtomicBoolean(false);
        asyncHandle.addResponseCompleteHandler(responseInfo -> {
            if (!responseInfo.completedSuccessfully() && !contextFuture.isDone()) {
                clientGone.set(true);
                log.info("Request {} ended before the context for {} was built, so it will not be rendered", request, info.templateName());
                contextFuture.cancel(false);
            }
        });

        contextFuture.whenComplete((context, throwable) -> {
            if (throwable != null) {
                Throwable cause = unwrap(throwable);
                if (cause instanceof CancellationException && clientGone.get()) {
                    notifyComplete(info, cause);
                } else {
                    sendErrorResponse(info, asyncHandle, cause);
                }
                return;
            }
            render(info, asyncHandle, context);
        });
        return true;
    }

    private void render(PageInfoImpl info, AsyncHandle asyncHandle, Map<String, Object> context) {
        MuResponse response = info.response();
        String html;
        try {
            if (context == null) {
                throw new IllegalStateException("The context builder completed with a null context");
            }
            for (PageListener pageListener : pageListeners) {
                pageListener.onBeforeRender(info, context);
            }
            html = pages.templateEngine().render(info.templateName(), context);
        } catch (Throwable e) {
            sendErrorResponse(info, asyncHandle, e);
            return;
        }

        if (response.hasStartedSendingData()) {
            IllegalStateException e = new IllegalStateException("Was going to send " + info.templateName() + " but response was already started or closed");
            asyncHandle.complete(e);
            notifyComplete(info, e);
            return;
        }
        response.status(200);
        response.contentType(ContentTypes.TEXT_HTML_UTF8);
        asyncHandle.write(Mutils.toByteBuffer(html), writeError -> {
            if (writeError == null) {
                asyncHandle.complete();
            } else {
                asyncHandle.complete(writeError);
            }
            notifyComplete(info, writeError);
        });
    }

    private void sendErrorResponse(PageInfoImpl info, AsyncHandle asyncHandle, Throwable e) {
        MuRequest request = info.request();
        MuResponse response = info.response();
        String errorId = UUID.randomUUID().toString();
        log.error(String.format("Error rendering template page. ErrorID=%s, template=%s, request.uri=%s, response.hasStartedSendingData=%s",
            errorId, info.templateName(), request.uri(), response.hasStartedSendingData()), e);
        try {
            if (response.hasStartedSendingData()) {
                asyncHandle.complete(e);
            } else {
                String header = "500 Internal Server Error";
                response.status(500);
                response.contentType(ContentTypes.TEXT_HTML_UTF8);
                String html = "<html><head><title>" + header + "</title><body>"
                    + "<h1>" + header + "</h1><p>"
                    + "Server ErrorID=" + errorId + "</p></body></html>";
                asyncHandle.write(Mutils.toByteBuffer(html), writeError -> {
                    if (writeError == null) {
                        asyncHandle.complete();
                    } else {
                        asyncHandle.complete(writeError);
                    }
                });
            }
        } catch (Throwable e1) {
            log.info("Fail to send error msg.", e1);
            asyncHandle.complete(e1);
        }
        notifyComplete(info, e);
    }

    private void notifyComplete(PageInfoImpl info, Throwable error) {
        info.complete(error);
        for (PageListener pageListener : pageListeners) {
            try {
                pageListener.onComplete(info);
            } catch (Exception e) {
                log.warn("Error thrown by " + pageListener, e);
            }
        }
    }

    private static Throwable unwrap(Throwable throwable) {
        if (throwable instanceof CompletionException && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

    private static class PageInfoImpl implements PageInfo {
        private final String templateName;
        private final MuRequest request;
        private final MuResponse response;
        private volatile long durationMillis = -1;
        private volatile Throwable error;

        PageInfoImpl(String templateName, MuRequest request, MuResponse response) {
            this.templateName = templateName;
            this.request = request;
            this.response = response;
        }

        void complete(Throwable error) {
            this.error = error;
            this.durationMillis = System.currentTimeMillis() - request.startTime();
        }

        @Override
        public String templateName() {
            return templateName;
        }

        @Override
        public MuRequest request() {
            return request;
        }

        @Override
        public MuResponse response() {
            return response;
        }

        @Override
        public long durationMillis() {
            long duration = durationMillis;
            return duration == -1 ? System.currentTimeMillis() - request.startTime() : duration;
        }

        @Override
        public Throwable errorIfAny() {
            return error;
        }

        @Override
        public String toString() {
            return "PageInfo{" +
                "templateName='" + templateName + '\'' +
                ", request=" + request +
                ", durationMillis=" + durationMillis() +
                ", error=" + error +
                '}';
        }
    }
}
