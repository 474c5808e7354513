package grove.outline;

import java.util.List;

/*
 * Persistence collaborator. Receives the placements that changed after each effective edit.
 * */
public interface OutlineStore<K> {

  void save(List<Placement<K>> changed);
}
