package com.propertyintel.listing.media;

import com.propertyintel.listing.model.ListingImage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies listing images into the {@link BlobStore} and records where each copy lives.
 * Images already stored are not downloaded again. A failed download leaves that image
 * pointing at the source URL only.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImageMirror {

    private final RestTemplate restTemplate;
    private final BlobStore blobStore;

    public List<ListingImage> mirror(String externalId, List<ListingImage> images) {
        List<ListingImage> mirrored = new ArrayList<>(images.size());
        int stored = 0;
        for (ListingImage image : images) {
            String name = blobName(externalId, image.url());
            if (blobStore.exists(name)) {
                mirrored.add(image.withLocalPath(blobStore.locationOf(name)));
                continue;
            }
            try {
                byte[] bytes = restTemplate.getForObject(image.url(), byte[].class);
                if (bytes == null || bytes.length == 0) {
                    log.warn("Empty image body for listing {}: {}", externalId, image.url());
                    mirrored.add(image);
                    continue;
                }
                mirrored.add(image.withLocalPath(blobStore.put(bytes, name)));
                stored++;
            } catch (RestClientException e) {
                log.warn("Could not download image for listing {} from {}: {}", externalId, image.url(), e.getMessage());
                mirrored.add(image);
            }
        }
        log.debug("Mirrored {} new images for listing {}", stored, externalId);
        return mirrored;
    }

    static String blobName(String externalId, String url) {
        String path = UriComponentsBuilder.fromUriString(url).build().getPath();
        String extension = path == null ? null : StringUtils.getFilenameExtension(path);
        String hash = DigestUtils.md5DigestAsHex(url.getBytes(StandardCharsets.UTF_8));
        return "property_" + externalId + "/" + hash + "." + (StringUtils.hasText(extension) ? extension : "jpg");
    }
}
