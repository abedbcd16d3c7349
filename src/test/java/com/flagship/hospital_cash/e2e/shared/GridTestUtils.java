package com.flagship.hospital_cash.e2e.shared;

import org.openqa.selenium.By;
import org.openqa.selenium.NoSuchElementException;
import org.openqa.selenium.SearchContext;
import org.openqa.selenium.WebElement;

import java.util.List;

/**
 * Lookups inside ui-grid tables.
 *
 * Row and column indexes are zero-based and count rendered rows and columns only.
 */
public final class GridTestUtils {

    public static final By BODY_CONTAINER = By.cssSelector(".ui-grid-render-container-body");

    public static final By RENDERED_ROWS =
        repeater("(rowRenderIndex, row) in rowContainer.renderedRows track by $index");

    public static final By RENDERED_CELLS =
        repeater("(colRenderIndex, col) in colContainer.renderedColumns track by col.uid");

    private GridTestUtils() {
        // Utility class
    }

    /**
     * Locates elements by the exact {@code ng-repeat} expression that rendered them.
     */
    public static By repeater(String expression) {
        return By.cssSelector("[ng-repeat=\"" + expression + "\"]");
    }

    public static WebElement getGrid(SearchContext context, String gridId) {
        return context.findElement(By.id(gridId));
    }

    public static List<WebElement> getRows(SearchContext context, String gridId) {
        return getGrid(context, gridId)
            .findElement(BODY_CONTAINER)
            .findElements(RENDERED_ROWS);
    }

    public static WebElement dataCell(SearchContext context, String gridId, int row, int column) {
        List<WebElement> rows = getRows(context, gridId);
        if (row < 0 || row >= rows.size()) {
            throw new NoSuchElementException("Grid " + gridId + " has no row " + row + " (rows=" + rows.size() + ")");
        }

        List<WebElement> cells = rows.get(row).findElements(RENDERED_CELLS);
        if (column < 0 || column >= cells.size()) {
            throw new NoSuchElementException("Grid " + gridId + " row " + row + " has no column " + column);
        }
        return cells.get(column);
    }
}
