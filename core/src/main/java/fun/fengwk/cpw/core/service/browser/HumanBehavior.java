package fun.fengwk.cpw.core.service.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.BoundingBox;
import com.microsoft.playwright.options.WaitUntilState;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Drives one page the way a person would: think time before and after navigation, wheel scrolling
 * in small steps, curved mouse paths and the occasional idle wander.
 *
 * <p>Instances are bound to a page and remember the last mouse position, create one per task.
 *
 * @author fengwk
 */
public class HumanBehavior {

    private final Page page;
    private final HumanProperties humanProperties;
    private final Random random;
    private double mouseX;
    private double mouseY;

    public HumanBehavior(Page page, HumanProperties humanProperties) {
        this(page, humanProperties, ThreadLocalRandom.current());
    }

    HumanBehavior(Page page, HumanProperties humanProperties, Random random) {
        this.page = page;
        this.humanProperties = humanProperties;
        this.random = random;
    }

    /**
     * Random delay in {@code [min, max]} scaled by the configured delay scale, zero when disabled.
     */
    public long randomDelay(long min, long max) {
        if (!humanProperties.isEnabled()) {
            return 0;
        }
        long lower = Math.max(0, Math.min(min, max));
        long upper = Math.max(lower, max);
        long raw = lower + (upper > lower ? (long) (random.nextDouble() * (upper - lower + 1)) : 0);
        return Math.round(Math.min(raw, upper) * Math.max(0, humanProperties.getDelayScale()));
    }

    public void think(long min, long max) {
        long millis = randomDelay(min, max);
        if (millis > 0) {
            page.waitForTimeout(millis);
        }
    }

    public void navigate(String url, long timeoutMs) {
        think(500, 1200);
        page.navigate(url, new Page.NavigateOptions()
            .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
            .setTimeout(timeoutMs));
        think(800, 2000);
    }

    /**
     * A few downward scrolls with reading pauses.
     */
    public void browse() {
        if (!humanProperties.isEnabled()) {
            return;
        }
        int scrolls = 2 + random.nextInt(4);
        for (int i = 0; i < scrolls; i++) {
            smoothScroll(300 + random.nextInt(501));
            think(400, 900);
        }
    }

    /**
     * Scroll by wheel steps, negative distances scroll up.
     */
    public void smoothScroll(long distancePx) {
        if (distancePx == 0) {
            return;
        }
        if (!humanProperties.isEnabled()) {
            page.mouse().wheel(0, distancePx);
            return;
        }
        long step = Math.max(1, humanProperties.getScrollStepPx());
        long remaining = Math.abs(distancePx);
        long direction = Long.signum(distancePx);
        while (remaining > 0) {
            long delta = Math.min(step, remaining);
            page.mouse().wheel(0, direction * delta);
            remaining -= delta;
            think(10, 30);
        }
    }

    public void moveTo(Locator target) {
        if (!humanProperties.isEnabled()) {
            return;
        }
        BoundingBox box = target.boundingBox();
        if (box == null) {
            return;
        }
        double x = box.x + box.width / 2 + (random.nextInt(21) - 10);
        double y = box.y + box.height / 2 + (random.nextInt(11) - 5);
        moveMouse(x, y);
    }

    /**
     * Bring the target into view, move onto it, hesitate, click.
     */
    public void click(Locator target, double timeoutMs) {
        target.scrollIntoViewIfNeeded();
        moveTo(target);
        think(200, 500);
        target.click(new Locator.ClickOptions().setTimeout(timeoutMs));
    }

    /**
     * @return whether the mouse wandered
     */
    public boolean occasionalWander() {
        if (!humanProperties.isEnabled() || random.nextDouble() >= humanProperties.getWanderChance()) {
            return false;
        }
        moveMouse(100 + random.nextInt(701), 100 + random.nextInt(501));
        think(300, 600);
        return true;
    }

    void moveMouse(double targetX, double targetY) {
        double[] jitter = new double[4];
        for (int i = 0; i < jitter.length; i++) {
            jitter[i] = random.nextInt(101) - 50;
        }
        for (MousePoint point : bezierPath(mouseX, mouseY, targetX, targetY, jitter, humanProperties.getMouseSteps())) {
            page.mouse().move(point.x(), point.y());
            think(8, 20);
            mouseX = point.x();
            mouseY = point.y();
        }
    }

    /**
     * Points of a cubic bezier from the start to the target, control points at 30% and 70% of the
     * straight line shifted by {@code jitter} (cp1 x, cp1 y, cp2 x, cp2 y).
     */
    static List<MousePoint> bezierPath(double fromX, double fromY, double toX, double toY, double[] jitter, int steps) {
        int count = Math.max(1, steps);
        double cp1x = fromX + (toX - fromX) * 0.3 + jitter[0];
        double cp1y = fromY + (toY - fromY) * 0.3 + jitter[1];
        double cp2x = fromX + (toX - fromX) * 0.7 + jitter[2];
        double cp2y = fromY + (toY - fromY) * 0.7 + jitter[3];
        List<MousePoint> points = new ArrayList<>(count + 1);
        for (int i = 0; i <= count; i++) {
            double t = (double) i / count;
            points.add(new MousePoint(cubic(fromX, cp1x, cp2x, toX, t), cubic(fromY, cp1y, cp2y, toY, t)));
        }
        return points;
    }

    private static double cubic(double p0, double p1, double p2, double p3, double t) {
        double u = 1 - t;
        return u * u * u * p0 + 3 * u * u * t * p1 + 3 * u * t * t * p2 + t * t * t * p3;
    }

    record MousePoint(double x, double y) {
    }

}
