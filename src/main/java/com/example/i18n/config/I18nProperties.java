package com.example.i18n.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under the {@code i18n} prefix.
 */
@Validated
@ConfigurationProperties(prefix = "i18n")
public class I18nProperties {

    /** Directory with one {@code <language>.json} file per language. */
    @NotBlank
    private String langDir = "./lang";

    @NotBlank
    private String defaultLang = "en-US";

    /** Environment variable (or property) holding the run mode; {@code prod} disables debug output. */
    @NotBlank
    private String envKey = "RUN_MODE";

    private boolean debugMode = false;

    @NotBlank
    private String langHeader = "lang";

    @NotBlank
    private String debugHeader = "debug";

    @NotBlank
    private String traceIdAttribute = "trace_id";

    @NotBlank
    private String callbackParam = "callback";

    /** Envelope code for exceptions that carry no code of their own. */
    private int errorCode = 500;

    private boolean exceptionHandler = true;

    public String getLangDir() {
        return langDir;
    }

    public void setLangDir(String langDir) {
        this.langDir = langDir;
    }

    public String getDefaultLang() {
        return defaultLang;
    }

    public void setDefaultLang(String defaultLang) {
        this.defaultLang = defaultLang;
    }

    public String getEnvKey() {
        return envKey;
    }

    public void setEnvKey(String envKey) {
        this.envKey = envKey;
    }

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public String getLangHeader() {
        return langHeader;
    }

    public void setLangHeader(String langHeader) {
        this.langHeader = langHeader;
    }

    public String getDebugHeader() {
        return debugHeader;
    }

    public void setDebugHeader(String debugHeader) {
        this.debugHeader = debugHeader;
    }

    public String getTraceIdAttribute() {
        return traceIdAttribute;
    }

    public void setTraceIdAttribute(String traceIdAttribute) {
        this.traceIdAttribute = traceIdAttribute;
    }

    public String getCallbackParam() {
        return callbackParam;
    }

    public void setCallbackParam(String callbackParam) {
        this.callbackParam = callbackParam;
    }

    public int getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(int errorCode) {
        this.errorCode = errorCode;
    }

    public boolean isExceptionHandler() {
        return exceptionHandler;
    }

    public void setExceptionHandler(boolean exceptionHandler) {
        this.exceptionHandler = exceptionHandler;
    }
}
