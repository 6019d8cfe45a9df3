package fun.fengwk.cpw.core.service.variant.impl;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import fun.fengwk.cpw.core.service.browser.HumanBehavior;
import fun.fengwk.cpw.core.service.variant.VariantPageDriver;
import fun.fengwk.cpw.core.service.variant.VariantProperties;
import fun.fengwk.cpw.core.service.variant.model.OptionGroup;
import fun.fengwk.cpw.core.service.variant.model.PriceQuote;
import fun.fengwk.cpw.core.service.variant.model.VariantOption;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Variant page driver over the listing page sku panel.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightVariantPageDriver implements VariantPageDriver {

    private static final String HELPERS = """
        const resolveContainers = (arg) => {
          const panel = document.querySelector(arg.panel);
          if (!panel) return [];
          return Array.from(panel.querySelectorAll(arg.groups.join(',')))
            .filter((el) => el.querySelector('[data-vid]'));
        };
        const normalize = (s) => String(s == null ? '' : s).replace(/\\s+/g, ' ').trim();
        const isDisabled = (node) => node.getAttribute('data-disabled') === 'true'
          || /disabled|invalid|soldout|out/i.test(String(node.getAttribute('class') || ''));
        const isSelected = (node) => ['aria-selected', 'aria-checked', 'aria-pressed', 'data-selected']
            .some((name) => node.getAttribute(name) === 'true')
          || /selected|active|checked|isSelected|chosen|current/i.test(String(node.getAttribute('class') || ''));
        """;

    static final String LIST_GROUPS_SCRIPT = "(arg) => {" + HELPERS + """
          return resolveContainers(arg).map((container, idx) => {
            const labelEl = container.querySelector('[class*="propName"]')
              || container.querySelector('[class*="name"]')
              || container.querySelector('dt')
              || container.querySelector('label');
            let name = normalize(labelEl && labelEl.textContent);
            if (!name || name.length > 40) name = '规格' + (idx + 1);
            return { id: String(idx), name };
          });
        }
        """;

    static final String LIST_OPTIONS_SCRIPT = "(arg) => {" + HELPERS + """
          const container = resolveContainers(arg)[arg.index];
          if (!container) return [];
          const seen = new Set();
          const options = [];
          for (const node of Array.from(container.querySelectorAll('[data-vid]'))) {
            const vid = node.getAttribute('data-vid');
            if (!vid || seen.has(vid) || isDisabled(node)) continue;
            seen.add(vid);
            let label = normalize(node.getAttribute('title')) || normalize(node.textContent);
            if (!label) {
              const img = node.querySelector('img');
              label = img ? normalize(img.getAttribute('alt') || img.getAttribute('title')) : '';
            }
            options.push({ id: vid, label: label || vid });
          }
          return options;
        }
        """;

    static final String IS_SELECTED_SCRIPT = "(arg) => {" + HELPERS + """
          const container = resolveContainers(arg)[arg.index];
          if (!container) return false;
          const node = container.querySelector('[data-vid="' + arg.vid + '"]');
          return node ? isSelected(node) : false;
        }
        """;

    static final String RESOLVE_KEY_SCRIPT = "(arg) => {" + HELPERS + """
          const skuId = new URL(location.href).searchParams.get('skuId');
          if (skuId) return skuId;
          const vids = [];
          for (const container of resolveContainers(arg)) {
            const selected = Array.from(container.querySelectorAll('[data-vid]')).find(isSelected);
            if (!selected) return null;
            vids.push(selected.getAttribute('data-vid'));
          }
          return vids.length ? vids.join(';') : null;
        }
        """;

    static final String READ_PRICE_SCRIPT = """
        (selectors) => {
          for (const selector of selectors) {
            const el = document.querySelector(selector);
            const text = el ? String(el.textContent || '').replace(/\\s+/g, '') : '';
            const match = text.match(/\\d+(?:\\.\\d+)?/);
            if (!match) continue;
            const originEl = document.querySelector('[class*="originPrice"], [class*="OriginPrice"], del');
            const originText = originEl ? String(originEl.textContent || '').replace(/\\s+/g, '') : '';
            const originMatch = originText.match(/\\d+(?:\\.\\d+)?/);
            return { token: text, finalPrice: match[0], originalPrice: originMatch ? originMatch[0] : null };
          }
          return null;
        }
        """;

    static final String THUMBNAIL_SCRIPT = """
        () => {
          const img = document.querySelector('img[class*="mainPic"], img[class*="MainPic"], #J_ImgBooth');
          const src = img ? (img.getAttribute('src') || '') : '';
          return src ? (src.startsWith('//') ? 'https:' + src : src) : null;
        }
        """;

    private final Page page;
    private final VariantProperties variantProperties;
    private final HumanBehavior human;

    public PlaywrightVariantPageDriver(Page page, VariantProperties variantProperties, HumanBehavior human) {
        this.page = page;
        this.variantProperties = variantProperties;
        this.human = human;
    }

    @Override
    public List<OptionGroup> listGroups() {
        List<OptionGroup> groups = new ArrayList<>();
        for (Map<?, ?> row : asRows(page.evaluate(LIST_GROUPS_SCRIPT, baseArg()))) {
            groups.add(new OptionGroup(String.valueOf(row.get("id")), String.valueOf(row.get("name"))));
        }
        return groups;
    }

    @Override
    public List<VariantOption> listEnabledOptions(OptionGroup group) {
        Map<String, Object> arg = baseArg();
        arg.put("index", Integer.parseInt(group.id()));
        List<VariantOption> options = new ArrayList<>();
        for (Map<?, ?> row : asRows(page.evaluate(LIST_OPTIONS_SCRIPT, arg))) {
            options.add(new VariantOption(String.valueOf(row.get("id")), String.valueOf(row.get("label"))));
        }
        return options;
    }

    @Override
    public boolean select(OptionGroup group, VariantOption option) {
        if (isSelected(group, option)) {
            return true;
        }
        Locator target = page.locator(variantProperties.getPanelSelector())
            .locator(String.join(", ", variantProperties.getGroupSelectors()))
            .filter(new Locator.FilterOptions().setHas(page.locator("[data-vid]")))
            .nth(Integer.parseInt(group.id()))
            .locator("[data-vid=\"" + option.id() + "\"]")
            .first();
        try {
            human.click(target, variantProperties.getSelectTimeoutMs());
        } catch (RuntimeException ex) {
            log.debug("option click failed, group={}, option={}, error={}", group.id(), option.id(), ex.getMessage());
            return false;
        }
        long deadline = System.currentTimeMillis() + variantProperties.getSelectTimeoutMs();
        while (System.currentTimeMillis() < deadline) {
            if (isSelected(group, option)) {
                return true;
            }
            page.waitForTimeout(variantProperties.getSelectPollIntervalMs());
        }
        return isSelected(group, option);
    }

    @Override
    public PriceQuote readPrice() {
        Object raw = page.evaluate(READ_PRICE_SCRIPT, variantProperties.getPriceSelectors());
        if (!(raw instanceof Map<?, ?> row)) {
            return null;
        }
        return new PriceQuote(
            String.valueOf(row.get("token")),
            toDecimal(row.get("finalPrice")),
            toDecimal(row.get("originalPrice"))
        );
    }

    @Override
    public String resolveVariantKey() {
        Object raw = page.evaluate(RESOLVE_KEY_SCRIPT, baseArg());
        return raw == null ? null : raw.toString();
    }

    @Override
    public String readThumbnail() {
        Object raw = page.evaluate(THUMBNAIL_SCRIPT);
        return raw == null ? null : raw.toString();
    }

    @Override
    public void pause(long millis) {
        if (millis > 0) {
            page.waitForTimeout(millis);
        }
    }

    private boolean isSelected(OptionGroup group, VariantOption option) {
        Map<String, Object> arg = baseArg();
        arg.put("index", Integer.parseInt(group.id()));
        arg.put("vid", option.id());
        return Boolean.TRUE.equals(page.evaluate(IS_SELECTED_SCRIPT, arg));
    }

    private Map<String, Object> baseArg() {
        Map<String, Object> arg = new LinkedHashMap<>();
        arg.put("panel", variantProperties.getPanelSelector());
        arg.put("groups", variantProperties.getGroupSelectors());
        return arg;
    }

    private List<Map<?, ?>> asRows(Object raw) {
        List<Map<?, ?>> rows = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    rows.add(map);
                }
            }
        }
        return rows;
    }

    private BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.toString());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

}
