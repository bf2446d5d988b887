package github.sarthakdev143.slideshow_factory.service.impl;

import github.sarthakdev143.slideshow_factory.model.MediaSource;
import github.sarthakdev143.slideshow_factory.service.MediaStore;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MediaStoreRegistry {

    private final Map<MediaSource, MediaStore> stores = new EnumMap<>(MediaSource.class);

    public MediaStoreRegistry(List<MediaStore> stores) {
        for (MediaStore store : stores) {
            this.stores.put(store.source(), store);
        }
    }

    public MediaStore forSource(MediaSource source) {
        MediaStore store = stores.get(source);
        if (store == null) {
            throw new IllegalStateException("No media store registered for " + source);
        }
        return store;
    }
}
