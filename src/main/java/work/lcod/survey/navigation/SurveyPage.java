package work.lcod.survey.navigation;

import java.util.List;
import work.lcod.survey.model.FormNode;

/**
 * One navigation step: the page (or, in pageless mode, the block) id and the blocks shown.
 */
public record SurveyPage(String id, List<FormNode> blocks) {
    public SurveyPage {
        blocks = List.copyOf(blocks);
    }

    public int indexOf(String blockId) {
        for (int i = 0; i < blocks.size(); i++) {
            if (blocks.get(i).id().equals(blockId)) {
                return i;
            }
        }
        return -1;
    }
}
