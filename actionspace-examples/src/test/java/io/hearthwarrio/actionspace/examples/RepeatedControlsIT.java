package io.hearthwarrio.actionspace.examples;

import io.hearthwarrio.actionspace.core.action.ActionSpace;
import io.hearthwarrio.actionspace.core.resolution.ResolutionConfig;
import io.hearthwarrio.actionspace.core.resolution.ResolutionResult;
import io.hearthwarrio.actionspace.core.resolution.UniqueSelector;
import io.hearthwarrio.actionspace.webdriver.ActionSpaceWebDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RepeatedControlsIT {

    private WebDriver driver;

    @BeforeEach
    void openShop() {
        ChromeOptions options = new ChromeOptions();
        options.addArguments("--headless=new");

        driver = new ChromeDriver(options);
        driver.manage().window().maximize();

        Path page = Paths.get("src", "test", "resources", "pages", "shop.html");
        driver.get(page.toUri().toString());
    }

    @AfterEach
    void tearDown() {
        if (driver != null) {
            driver.quit();
        }
    }

    @Test
    void identicalButtonsAreToldApartByTheirCard() {
        ActionSpaceWebDriver actionSpace = new ActionSpaceWebDriver(driver)
                .logSelectors()
                .checkSelectors();

        actionSpace.observe();
        List<String> addToCart = Actions.idsOf(actionSpace.actionSpace(), "button 'Add to cart'");
        assertEquals(3, addToCart.size(), "one Add to cart action per card");

        actionSpace.click(addToCart.get(1));

        assertEquals("Blue mug", driver.findElement(By.id("result")).getText());
    }

    @Test
    void linksToTheSameTargetAreInterchangeable() {
        ActionSpaceWebDriver actionSpace = new ActionSpaceWebDriver(driver).logSelectors();

        actionSpace.observe();
        List<String> help = Actions.idsOf(actionSpace.actionSpace(), "link 'Help'");
        assertEquals(2, help.size());

        UniqueSelector selector = actionSpace.resolve(help.get(1)).orElseThrow();
        assertEquals("link-href", selector.getStrategyId());
    }

    @Test
    void withoutConflictResolutionRepeatedButtonsFailLocally() {
        ActionSpaceWebDriver actionSpace = new ActionSpaceWebDriver(driver)
                .withResolutionConfig(ResolutionConfig.DEFAULT.withConflictResolution(false))
                .logSelectors();

        actionSpace.observe();
        ActionSpace space = actionSpace.actionSpace();

        ResolutionResult repeated = actionSpace.resolve(Actions.idsOf(space, "button 'Add to cart'").get(0));
        assertFalse(repeated.isResolved());
        assertTrue(repeated.getFailure().orElseThrow().report().contains("conflict resolution is disabled"));

        actionSpace.fill(Actions.idOf(space, "textbox 'Coupon'"), "MUGS10");
        assertEquals("MUGS10", driver.findElement(By.id("coupon")).getAttribute("value"));
    }
}
