package com.testflow.locator.selenium;

import com.testflow.locator.Bounds;
import com.testflow.locator.ElementAttribute;
import com.testflow.locator.ElementProvider;
import org.openqa.selenium.By;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;
import java.util.Optional;

/**
 * Presents a browser DOM as an element tree.
 *
 *   Name          the {@code name} attribute, else the accessible name
 *   AutomationId  the {@code id} attribute
 *   ClassName     the {@code class} attribute
 *   ControlType   the tag name
 *   Value         the {@code value} property, else the rendered text
 *
 * Children are the element children in document order. Empty attribute values are
 * reported as absent.
 */
public class WebDriverElementProvider implements ElementProvider<WebElement> {

    private static final By ROOT     = By.xpath("/*");
    private static final By CHILDREN = By.xpath("./*");

    private final WebDriver driver;

    public WebDriverElementProvider(WebDriver driver) {
        this.driver = driver;
    }

    @Override
    public WebElement getRoot() {
        return driver.findElement(ROOT);
    }

    @Override
    public List<WebElement> getChildren(WebElement node) {
        return node.findElements(CHILDREN);
    }

    @Override
    public Optional<String> getAttribute(WebElement node, ElementAttribute attribute) {
        String value = switch (attribute) {
            case NAME          -> nameOf(node);
            case AUTOMATION_ID -> node.getDomAttribute("id");
            case CLASS_NAME    -> node.getDomAttribute("class");
            case CONTROL_TYPE  -> node.getTagName();
            case VALUE         -> valueOf(node);
        };
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    @Override
    public Bounds getBounds(WebElement node) {
        Rectangle rect = node.getRect();
        return new Bounds(rect.getX(), rect.getY(), rect.getWidth(), rect.getHeight());
    }

    private static String valueOf(WebElement node) {
        String value = node.getDomProperty("value");
        return value != null && !value.isEmpty() ? value : node.getText();
    }

    private static String nameOf(WebElement node) {
        String name = node.getDomAttribute("name");
        return name != null && !name.isEmpty() ? name : node.getAccessibleName();
    }
}
