package com.testflow.locator.selenium;

import com.testflow.locator.Bounds;
import com.testflow.locator.ElementAttribute;
import com.testflow.locator.ElementLocator;
import com.testflow.locator.IdentifierKind;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.Rectangle;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

/**
 * Tests the Selenium adapters against mocked drivers and elements.
 */
public class WebDriverElementProviderTest {

    private WebDriver                driver;
    private WebElement               html;
    private WebElement               body;
    private WebElement               button;
    private WebDriverElementProvider provider;

    @BeforeMethod
    public void setUp() {
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        html   = element("html");
        body   = element("body");
        button = element("button");
        when(button.getDomAttribute("id")).thenReturn("ok");
        when(button.getDomAttribute("class")).thenReturn("primary");
        when(button.getAccessibleName()).thenReturn("OK");

        when(driver.findElement(By.xpath("/*"))).thenReturn(html);
        when(html.findElements(By.xpath("./*"))).thenReturn(List.of(body));
        when(body.findElements(By.xpath("./*"))).thenReturn(List.of(button));

        provider = new WebDriverElementProvider(driver);
    }

    private static WebElement element(String tag) {
        WebElement element = mock(WebElement.class);
        when(element.getTagName()).thenReturn(tag);
        return element;
    }

    // ════════════════════════════════════════════════════════════════════════
    // Provider
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void attributes_mapToDomAttributesAndTagName() {
        assertThat(provider.getAttribute(button, ElementAttribute.AUTOMATION_ID)).contains("ok");
        assertThat(provider.getAttribute(button, ElementAttribute.CLASS_NAME)).contains("primary");
        assertThat(provider.getAttribute(button, ElementAttribute.CONTROL_TYPE)).contains("button");
        assertThat(provider.getAttribute(button, ElementAttribute.NAME)).contains("OK");
    }

    @Test
    public void valueAttribute_prefersValuePropertyOverRenderedText() {
        WebElement input = element("input");
        when(input.getDomProperty("value")).thenReturn("typed");
        when(button.getText()).thenReturn("Press OK");

        assertThat(provider.getAttribute(input, ElementAttribute.VALUE)).contains("typed");
        assertThat(provider.getAttribute(button, ElementAttribute.VALUE)).contains("Press OK");
    }

    @Test
    public void nameAttribute_winsOverAccessibleName() {
        when(button.getDomAttribute("name")).thenReturn("submit");

        assertThat(provider.getAttribute(button, ElementAttribute.NAME)).contains("submit");
    }

    @Test
    public void emptyOrMissingValues_areAbsent() {
        when(body.getDomAttribute("class")).thenReturn("");

        assertThat(provider.getAttribute(body, ElementAttribute.CLASS_NAME)).isEmpty();
        assertThat(provider.getAttribute(body, ElementAttribute.AUTOMATION_ID)).isEmpty();
        assertThat(provider.getAttribute(body, ElementAttribute.NAME)).isEmpty();
    }

    @Test
    public void bounds_comeFromElementRect() {
        when(button.getRect()).thenReturn(new Rectangle(5, 6, 30, 20));

        assertThat(provider.getBounds(button)).isEqualTo(new Bounds(5, 6, 30, 20));
    }

    @Test
    public void locator_walksTheDomThroughTheProvider() {
        ElementLocator<WebElement> locator = new ElementLocator<>(provider);

        assertThat(locator.find(IdentifierKind.PATH, "body//button[@AutomationId='ok']")).containsSame(button);
        assertThat(locator.find(IdentifierKind.NAME, "OK")).containsSame(button);
        assertThat(locator.find(IdentifierKind.AUTOMATION_ID, "cancel")).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Interactor
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void setText_clearsOnlyWhenAsked() {
        WebElementInteractor interactor = new WebElementInteractor(driver);

        interactor.setText(button, "abc", true);
        verify(button).clear();
        verify(button).sendKeys("abc");

        WebElement other = element("input");
        interactor.setText(other, "def", false);
        verify(other, never()).clear();
        verify(other).sendKeys("def");
    }

    @Test
    public void invoke_runsScriptClickWhenDriverSupportsScripts() {
        assertThat(new WebElementInteractor(driver).invoke(button)).isTrue();
        verify((JavascriptExecutor) driver).executeScript("arguments[0].click();", button);
    }

    @Test
    public void invoke_withoutScriptSupport_reportsUnavailable() {
        WebDriver plain = mock(WebDriver.class);

        assertThat(new WebElementInteractor(plain).invoke(button)).isFalse();
        verify(button, never()).click();
    }

    @Test
    public void click_delegatesToElement() {
        new WebElementInteractor(driver).click(button);
        verify(button).click();
    }
}
