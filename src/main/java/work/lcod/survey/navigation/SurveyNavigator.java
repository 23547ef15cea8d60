package work.lcod.survey.navigation;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.survey.tree.DocumentTree;

/**
 * Step-level navigation on top of {@link NavigationEngine}: rules first, then the sequential
 * fallback (next block on the page, first block of the next page, submit after the last page).
 */
public final class SurveyNavigator {
    private final NavigationEngine engine;
    private final Logger log;

    public SurveyNavigator(NavigationEngine engine) {
        this(engine, LoggerFactory.getLogger(SurveyNavigator.class));
    }

    public SurveyNavigator(NavigationEngine engine, Logger log) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.log = Objects.requireNonNull(log, "log");
    }

    /** Next step after answering block {@code blockId}. */
    public StepTarget nextFromBlock(DocumentTree tree, String blockId, Map<String, ?> values) {
        var pages = SurveyPages.of(tree);
        var position = pages.positionOf(blockId);
        if (position.isEmpty()) {
            log.debug("Block {} is not on any page; submitting", blockId);
            return StepTarget.submit();
        }
        var result = engine.resolveNext(tree, blockId, values);
        if (result.matched()) {
            var target = locate(pages, result);
            if (target.isPresent()) {
                return target.get();
            }
            log.warn("Navigation target {} is not a page or block; falling back to the next step", result.target());
        }
        var pageIndex = position.get().pageIndex();
        var blockIndex = position.get().blockIndex();
        var page = pages.page(pageIndex);
        if (blockIndex + 1 < page.blocks().size()) {
            return StepTarget.position(pageIndex, blockIndex + 1, page.blocks().get(blockIndex + 1).id());
        }
        return firstBlockOf(pages, pageIndex + 1);
    }

    /**
     * Next step after leaving page {@code pageIndex}: the first block on the page whose rules
     * match decides, otherwise the next page.
     */
    public StepTarget nextFromPage(DocumentTree tree, int pageIndex, Map<String, ?> values) {
        var pages = SurveyPages.of(tree);
        if (pageIndex < 0 || pageIndex >= pages.size()) {
            return StepTarget.submit();
        }
        for (var block : pages.page(pageIndex).blocks()) {
            var result = engine.resolveNext(tree, block.navigationRules(), values);
            if (!result.matched()) {
                continue;
            }
            var target = locate(pages, result);
            if (target.isPresent()) {
                return target.get();
            }
        }
        return firstBlockOf(pages, pageIndex + 1);
    }

    private static Optional<StepTarget> locate(SurveyPages pages, NavigationResult result) {
        if (result.terminal()) {
            return Optional.of(StepTarget.submit());
        }
        var pageIndex = pages.indexOfPage(result.target());
        if (pageIndex >= 0) {
            var page = pages.page(pageIndex);
            var firstId = page.blocks().isEmpty() ? page.id() : page.blocks().get(0).id();
            return Optional.of(StepTarget.position(pageIndex, 0, firstId));
        }
        if (result.pageTarget()) {
            return Optional.empty();
        }
        return pages.positionOf(result.target())
            .map(pos -> StepTarget.position(pos.pageIndex(), pos.blockIndex(), result.target()));
    }

    private static StepTarget firstBlockOf(SurveyPages pages, int pageIndex) {
        if (pageIndex >= pages.size()) {
            return StepTarget.submit();
        }
        var page = pages.page(pageIndex);
        if (page.blocks().isEmpty()) {
            return firstBlockOf(pages, pageIndex + 1);
        }
        return StepTarget.position(pageIndex, 0, page.blocks().get(0).id());
    }
}
