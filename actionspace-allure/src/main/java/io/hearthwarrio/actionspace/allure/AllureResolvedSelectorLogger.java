package io.hearthwarrio.actionspace.allure;

import io.hearthwarrio.actionspace.core.resolution.ResolutionFailure;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;
import io.hearthwarrio.actionspace.webdriver.ResolvedSelectorLogger;
import io.hearthwarrio.actionspace.webdriver.SelectorLogDetail;
import io.qameta.allure.Allure;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Writes one Allure step per resolution, with the selector report as a text attachment.
 * A {@code null} detail is treated as {@link SelectorLogDetail#NONE}.
 */
public final class AllureResolvedSelectorLogger implements ResolvedSelectorLogger {

    private final WebDriver driver;
    private final SelectorLogDetail detail;
    private final boolean attachScreenshot;

    public AllureResolvedSelectorLogger(WebDriver driver, SelectorLogDetail detail, boolean attachScreenshot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.detail = detail == null ? SelectorLogDetail.NONE : detail;
        this.attachScreenshot = attachScreenshot;
    }

    @Override
    public SelectorLogDetail detail() {
        return detail;
    }

    @Override
    public void logResolvedSelector(String nodeId, String role, String name, UniqueSelector selector) {
        String title = "ActionSpace: " + safe(nodeId) + " - " + safe(role) + " '" + safe(name) + "'";

        Allure.step(title, () -> {
            StringBuilder sb = new StringBuilder(512);

            sb.append("id: ").append(safe(nodeId)).append('\n')
                    .append("role: ").append(safe(role)).append('\n')
                    .append("name: ").append(safe(name)).append('\n');

            if (detail != SelectorLogDetail.NONE) {
                sb.append("strategy: ").append(selector.getStrategyId()).append('\n');
                sb.append("selector: ").append(selector.getPrimarySelector()).append('\n');
            }
            if (detail == SelectorLogDetail.ALL) {
                for (String fallback : selector.getSelectors().subList(1, selector.getSelectors().size())) {
                    sb.append("fallback: ").append(fallback).append('\n');
                }
                for (String frame : selector.getIframePath()) {
                    sb.append("iframe: ").append(frame).append('\n');
                }
                sb.append("shadow root: ").append(selector.isInShadowRoot()).append('\n');
            }

            attachText("Resolved selector", sb.toString());
            attachScreenshotIfEnabled();
        });
    }

    @Override
    public void logUnresolved(ResolutionFailure failure) {
        String title = "ActionSpace: " + failure.getNodeId() + " unresolved";
        Allure.step(title, () -> {
            attachText("Resolution failure", failure.report());
            attachScreenshotIfEnabled();
        });
    }

    private void attachScreenshotIfEnabled() {
        if (attachScreenshot && driver instanceof TakesScreenshot) {
            byte[] png = ((TakesScreenshot) driver).getScreenshotAs(OutputType.BYTES);
            Allure.addAttachment(
                    "Screenshot",
                    "image/png",
                    new ByteArrayInputStream(png),
                    ".png"
            );
        }
    }

    static void attachText(String name, String text) {
        byte[] txt = text.getBytes(StandardCharsets.UTF_8);
        Allure.addAttachment(
                name,
                "text/plain",
                new ByteArrayInputStream(txt),
                ".txt"
        );
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
