package com.flagship.hospital_cash.e2e.shared;

import org.openqa.selenium.By;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

/**
 * The "add N rows" control shown above editable grids.
 */
public final class AddItemComponent {

    public static final By ROOT = By.cssSelector("[data-add-item]");
    public static final String INCREMENT_MODEL = "$ctrl.itemIncrement";
    public static final By ADD_BUTTON = By.cssSelector("[data-add-item] button");

    private AddItemComponent() {
        // Utility class
    }

    public static void set(SearchContext context, int rows) {
        WebElement root = context.findElement(ROOT);
        FormUtils.input(INCREMENT_MODEL, rows, root);
        context.findElement(ADD_BUTTON).click();
    }
}
