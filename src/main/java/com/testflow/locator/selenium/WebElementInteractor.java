package com.testflow.locator.selenium;

import com.testflow.locator.ElementInteractor;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clicks and types into elements resolved by a {@link WebDriverElementProvider}.
 */
public class WebElementInteractor implements ElementInteractor<WebElement> {

    private static final Logger log = LoggerFactory.getLogger(WebElementInteractor.class);

    private final WebDriver driver;

    public WebElementInteractor(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public void click(WebElement node) {
        node.click();
    }

    @Override
    public void doubleClick(WebElement node) {
        new Actions(driver).doubleClick(node).perform();
    }

    /** Dispatches a script click, which reaches elements covered by an overlay. */
    @Override
    public boolean invoke(WebElement node) {
        if (!(driver instanceof JavascriptExecutor js)) {
            log.debug("WebElementInteractor: driver cannot execute scripts; invoke unavailable");
            return false;
        }
        js.executeScript("arguments[0].click();", node);
        return true;
    }

    @Override
    public void setText(WebElement node, String text, boolean clearExisting) {
        if (clearExisting) {
            node.clear();
        }
        node.sendKeys(text);
    }
}
