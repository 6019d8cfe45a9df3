package fun.fengwk.cpw.core.service.cart.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.playwright.Page;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.cart.CartPageDriver;
import fun.fengwk.cpw.core.service.cart.CartProperties;
import fun.fengwk.cpw.core.service.cart.ScrollMetrics;
import fun.fengwk.cpw.core.service.cart.model.CartLineItem;

import java.util.List;
import java.util.Map;

/**
 * Cart page driver over a live playwright page.
 *
 * @author fengwk
 */
public class PlaywrightCartPageDriver implements CartPageDriver {

    static final String EXTRACT_ITEMS_SCRIPT = """
        () => {
          const text = (el) => (el && el.textContent ? el.textContent.trim() : '');
          const readPrice = (container) => {
            if (!container) return null;
            const integer = text(container.querySelector('.trade-price-integer')).replace(/[^0-9]/g, '');
            if (!integer) return null;
            const decimal = text(container.querySelector('.trade-price-decimal')).replace(/[^0-9]/g, '') || '0';
            return integer + '.' + decimal;
          };
          return Array.from(document.querySelectorAll('.trade-cart-item-info')).map((item) => {
            const link = item.querySelector('a[href*="item.taobao.com"], a[href*="detail.tmall.com"]');
            const href = link ? (link.getAttribute('href') || '') : '';
            const idMatch = href.match(/[?&]id=(\\d+)/);
            if (!idMatch) return null;
            const skuMatch = href.match(/[?&]skuId=(\\d+)/);
            const image = item.querySelector('img.image--MC0kGGgi');
            const src = image ? (image.getAttribute('src') || '') : '';
            const prices = Array.from(item.querySelectorAll('.trade-cart-item-price .trade-price-container'));
            const labels = Array.from(item.querySelectorAll('.trade-cart-item-sku-old .label--T4deixnF'))
              .map(text)
              .filter(Boolean);
            const row = item.closest('[class*="trade-cart-item"]') || item;
            const quantityInput = row.querySelector('[class*="quantity"] input, [class*="Quantity"] input');
            const quantity = quantityInput ? parseInt(quantityInput.value, 10) : NaN;
            return {
              listingId: idMatch[1],
              skuId: skuMatch ? skuMatch[1] : '',
              skuProperties: labels.join(' '),
              title: text(item.querySelector('a.title--dsuLK9IN')),
              imageUrl: src ? (src.startsWith('//') ? 'https:' + src : src) : null,
              finalPrice: readPrice(prices[0]),
              originalPrice: readPrice(prices[1]),
              quantity: Number.isFinite(quantity) && quantity > 0 ? quantity : 1
            };
          }).filter(Boolean);
        }
        """;

    static final String TOTAL_HINT_SCRIPT = """
        (pattern) => {
          const body = document.body ? document.body.innerText || '' : '';
          const match = body.match(new RegExp(pattern));
          return match ? parseInt(match[1], 10) : null;
        }
        """;

    static final String SCROLL_METRICS_SCRIPT = """
        () => ({
          position: Math.round(window.scrollY || document.documentElement.scrollTop || 0),
          viewportHeight: Math.round(window.innerHeight || 0),
          scrollHeight: Math.round(document.documentElement.scrollHeight || 0)
        })
        """;

    static final String TRAILING_TEXT_SCRIPT = """
        () => {
          const body = document.body ? document.body.innerText || '' : '';
          return body.slice(-600);
        }
        """;

    private final Page page;
    private final CartProperties cartProperties;
    private final ObjectMapper objectMapper;
    private final HumanBehavior human;

    public PlaywrightCartPageDriver(Page page, CartProperties cartProperties, ObjectMapper objectMapper, HumanBehavior human) {
        this.page = page;
        this.cartProperties = cartProperties;
        this.objectMapper = objectMapper;
        this.human = human;
    }

    @Override
    public List<CartLineItem> extractVisibleItems() {
        Object raw = page.evaluate(EXTRACT_ITEMS_SCRIPT);
        if (raw == null) {
            return List.of();
        }
        return objectMapper.convertValue(raw, new TypeReference<List<CartLineItem>>() {});
    }

    @Override
    public Integer readTotalHint() {
        Object raw = page.evaluate(TOTAL_HINT_SCRIPT, cartProperties.getTotalHintPattern());
        return raw instanceof Number number ? number.intValue() : null;
    }

    @Override
    public ScrollMetrics readScrollMetrics() {
        Object raw = page.evaluate(SCROLL_METRICS_SCRIPT);
        if (!(raw instanceof Map<?, ?> metrics)) {
            return new ScrollMetrics(0, 0, 0);
        }
        return new ScrollMetrics(
            toLong(metrics.get("position")),
            toLong(metrics.get("viewportHeight")),
            toLong(metrics.get("scrollHeight"))
        );
    }

    @Override
    public void scrollBy(long deltaPx) {
        human.smoothScroll(deltaPx);
    }

    @Override
    public void pause(long millis) {
        if (millis > 0) {
            page.waitForTimeout(millis);
        }
    }

    @Override
    public String readTrailingText() {
        Object raw = page.evaluate(TRAILING_TEXT_SCRIPT);
        return raw == null ? "" : raw.toString();
    }

    private long toLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

}
