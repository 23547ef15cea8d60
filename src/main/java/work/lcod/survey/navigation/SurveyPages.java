package work.lcod.survey.navigation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import work.lcod.survey.model.ChildKind;
import work.lcod.survey.model.FormNode;
import work.lcod.survey.tree.DocumentTree;

/**
 * Ordered pages of a survey.
 *
 * <p>Paged mode: every page under the root (then under each nested section, depth first) is a
 * step; a container holding blocks but no pages counts as a single page. Pageless mode: every
 * block under the root is its own step, pages being flattened.</p>
 */
public final class SurveyPages {
    private final SurveyMode mode;
    private final List<SurveyPage> pages;

    private SurveyPages(SurveyMode mode, List<SurveyPage> pages) {
        this.mode = mode;
        this.pages = List.copyOf(pages);
    }

    public static SurveyPages of(DocumentTree tree) {
        return of(tree, detectMode(tree));
    }

    public static SurveyPages of(DocumentTree tree, SurveyMode mode) {
        var pages = new ArrayList<SurveyPage>();
        var root = tree.root();
        if (mode == SurveyMode.PAGELESS) {
            for (var item : items(tree, root)) {
                if (item.isPage()) {
                    for (var block : items(tree, item)) {
                        pages.add(new SurveyPage(block.id(), List.of(block)));
                    }
                } else {
                    pages.add(new SurveyPage(item.id(), List.of(item)));
                }
            }
        } else {
            collectPaged(tree, root, pages);
        }
        if (pages.isEmpty()) {
            pages.add(new SurveyPage(root.id(), List.of()));
        }
        return new SurveyPages(mode, pages);
    }

    /** Paged when the root has no items or at least one of them is a page. */
    public static SurveyMode detectMode(DocumentTree tree) {
        var items = items(tree, tree.root());
        if (items.isEmpty()) {
            return SurveyMode.PAGED;
        }
        return items.stream().anyMatch(FormNode::isPage) ? SurveyMode.PAGED : SurveyMode.PAGELESS;
    }

    public SurveyMode mode() {
        return mode;
    }

    public List<SurveyPage> pages() {
        return pages;
    }

    public int size() {
        return pages.size();
    }

    public SurveyPage page(int index) {
        return pages.get(index);
    }

    public List<String> pageIds() {
        return pages.stream().map(SurveyPage::id).toList();
    }

    public int indexOfPage(String pageId) {
        for (int i = 0; i < pages.size(); i++) {
            if (pages.get(i).id().equals(pageId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<BlockPosition> positionOf(String blockId) {
        for (int pageIndex = 0; pageIndex < pages.size(); pageIndex++) {
            var blockIndex = pages.get(pageIndex).indexOf(blockId);
            if (blockIndex >= 0) {
                return Optional.of(new BlockPosition(pageIndex, blockIndex));
            }
        }
        return Optional.empty();
    }

    private static void collectPaged(DocumentTree tree, FormNode container, List<SurveyPage> pages) {
        var items = items(tree, container);
        var pageItems = items.stream().filter(FormNode::isPage).toList();
        if (!pageItems.isEmpty()) {
            for (var page : pageItems) {
                var blocks = items(tree, page);
                if (!blocks.isEmpty()) {
                    pages.add(new SurveyPage(page.id(), blocks));
                }
            }
        } else if (!items.isEmpty()) {
            pages.add(new SurveyPage(container.id(), items));
        }
        for (var childId : container.embeddedChildIds(ChildKind.NODE)) {
            tree.find(childId)
                .filter(FormNode::isSection)
                .ifPresent(section -> collectPaged(tree, section, pages));
        }
    }

    private static List<FormNode> items(DocumentTree tree, FormNode node) {
        var result = new ArrayList<FormNode>();
        for (var id : node.embeddedChildIds(ChildKind.ITEM)) {
            tree.find(id).ifPresent(result::add);
        }
        return result;
    }

    public record BlockPosition(int pageIndex, int blockIndex) {}
}
