package io.hearthwarrio.actionspace.allure;

import io.hearthwarrio.actionspace.webdriver.ResolvedSelectorLogger;
import io.hearthwarrio.actionspace.webdriver.SelectorLogDetail;
import org.openqa.selenium.WebDriver;

/**
 * Entry point for reporting resolved selectors as Allure steps.
 * <p>
 * Pass the result to {@code ActionSpaceWebDriver.withLogger(...)}. Each resolved element ID becomes a step
 * titled with the ID, role and name, holding the chosen selectors as a text attachment. IDs that cannot be
 * resolved get a step with the failure report.
 */
public final class ActionSpaceAllureLoggers {

    private ActionSpaceAllureLoggers() {
    }

    /**
     * Every selector of each resolution, no screenshots.
     */
    public static ResolvedSelectorLogger resolvedSelectors(WebDriver driver) {
        return new AllureResolvedSelectorLogger(driver, SelectorLogDetail.ALL, false);
    }

    /**
     * @param detail      which selectors end up in the attachment
     * @param screenshots also attach a page screenshot to each step
     */
    public static ResolvedSelectorLogger resolvedSelectors(
            WebDriver driver,
            SelectorLogDetail detail,
            boolean screenshots
    ) {
        return new AllureResolvedSelectorLogger(driver, detail, screenshots);
    }
}
