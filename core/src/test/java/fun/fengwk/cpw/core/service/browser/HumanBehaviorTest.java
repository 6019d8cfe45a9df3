package fun.fengwk.cpw.core.service.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Mouse;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.options.BoundingBox;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class HumanBehaviorTest {

    @Mock
    private Page page;

    @Mock
    private Mouse mouse;

    @Mock
    private Locator locator;

    private HumanProperties humanProperties;

    @BeforeEach
    public void setUp() {
        humanProperties = new HumanProperties();
        humanProperties.setDelayScale(0);
    }

    @Test
    public void shouldScrollInSmallWheelSteps() {
        when(page.mouse()).thenReturn(mouse);

        human().smoothScroll(50);

        verify(mouse, times(2)).wheel(0.0, 20.0);
        verify(mouse).wheel(0.0, 10.0);
    }

    @Test
    public void shouldScrollUpForNegativeDistance() {
        when(page.mouse()).thenReturn(mouse);

        human().smoothScroll(-40);

        verify(mouse, times(2)).wheel(0.0, -20.0);
    }

    @Test
    public void shouldScrollInOneWheelWhenDisabled() {
        humanProperties.setEnabled(false);
        when(page.mouse()).thenReturn(mouse);

        human().smoothScroll(860);

        verify(mouse).wheel(0.0, 860.0);
    }

    @Test
    public void shouldScaleDelays() {
        humanProperties.setDelayScale(0.5);

        assertThat(human().randomDelay(100, 100)).isEqualTo(50);
        assertThat(human().randomDelay(300, 100)).isEqualTo(50);
        assertThat(human().randomDelay(200, 400)).isBetween(100L, 200L);

        humanProperties.setEnabled(false);
        assertThat(human().randomDelay(200, 400)).isZero();
    }

    @Test
    public void shouldCurveFromStartToTarget() {
        List<HumanBehavior.MousePoint> points = HumanBehavior.bezierPath(
            0, 0, 100, 100, new double[] {0, 0, 0, 0}, 20);

        assertThat(points).hasSize(21);
        assertThat(points.get(0)).isEqualTo(new HumanBehavior.MousePoint(0, 0));
        assertThat(points.get(20).x()).isEqualTo(100.0);
        assertThat(points.get(20).y()).isEqualTo(100.0);
        assertThat(points).allSatisfy(point -> assertThat(point.x()).isCloseTo(point.y(), offset(1e-9)));

        List<HumanBehavior.MousePoint> bent = HumanBehavior.bezierPath(
            0, 0, 100, 0, new double[] {0, 50, 0, 50}, 20);
        assertThat(bent.get(10).y()).isGreaterThan(0);
        assertThat(bent.get(20).y()).isCloseTo(0.0, offset(1e-9));
    }

    @Test
    public void shouldWanderOnlyWhenChanceHits() {
        humanProperties.setWanderChance(0);
        assertThat(human().occasionalWander()).isFalse();
        verify(page, never()).mouse();

        humanProperties.setWanderChance(1);
        when(page.mouse()).thenReturn(mouse);
        assertThat(human().occasionalWander()).isTrue();
        verify(mouse, times(humanProperties.getMouseSteps() + 1)).move(anyDouble(), anyDouble());
    }

    @Test
    public void shouldNavigateWithDomContentLoaded() {
        human().navigate("https://cart.taobao.com/cart.htm", 30_000);

        verify(page).navigate(eq("https://cart.taobao.com/cart.htm"), any(Page.NavigateOptions.class));
        verify(page, never()).waitForTimeout(anyDouble());
    }

    @Test
    public void shouldMoveOntoTargetBeforeClicking() {
        BoundingBox box = new BoundingBox();
        box.x = 200;
        box.y = 300;
        box.width = 40;
        box.height = 20;
        when(locator.boundingBox()).thenReturn(box);
        when(page.mouse()).thenReturn(mouse);

        human().click(locator, 3000);

        InOrder order = inOrder(locator, mouse);
        order.verify(locator).scrollIntoViewIfNeeded();
        order.verify(mouse, times(humanProperties.getMouseSteps() + 1)).move(anyDouble(), anyDouble());
        order.verify(locator).click(any(Locator.ClickOptions.class));
    }

    private HumanBehavior human() {
        return new HumanBehavior(page, humanProperties, new Random(7));
    }

}
