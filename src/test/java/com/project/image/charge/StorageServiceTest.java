package com.project.image.charge;

import com.project.image.charge.exceptions.StorageException;
import com.project.image.charge.service.StorageService;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import java.nio.file.Files;
import java.nio.file.Path;
import static org.assertj.core.api.Assertions.*;

class StorageServiceTest {
    @Test
    void store_and_storeResultImage_work() throws Exception {
        Path tmp = Files.createTempDirectory("charge-uploads-test");
        StorageService storage = new StorageService(tmp.toString());

        MockMultipartFile file = new MockMultipartFile(
                "file", "my photo.png", "image/png", new byte[]{1, 2, 3, 4}
        );
        var stored = storage.store(file);
        assertThat(Files.exists(stored.path())).isTrue();
        assertThat(stored.filename()).endsWith("_my_photo.png");
        assertThat(stored.relativeWebPath()).isEqualTo("uploads/" + stored.filename());

        var res = storage.storeResultImage(new byte[]{8, 9, 10}, "l-contrast");
        assertThat(Files.readAllBytes(res.path())).containsExactly(8, 9, 10);
        assertThat(res.filename()).endsWith("_l-contrast.png");
    }

    @Test
    void store_rejectsNonImage() throws Exception {
        StorageService storage = new StorageService(Files.createTempDirectory("charge-uploads-test2").toString());

        MockMultipartFile notImage = new MockMultipartFile("file", "x.txt", "text/plain", "hi".getBytes());
        assertThatThrownBy(() -> storage.store(notImage)).isInstanceOf(StorageException.class);
    }

    @Test
    void storeResultImage_rejectsEmptyBytes() throws Exception {
        StorageService storage = new StorageService(Files.createTempDirectory("charge-uploads-test3").toString());

        assertThatThrownBy(() -> storage.storeResultImage(new byte[0], "charge"))
                .isInstanceOf(StorageException.class);
    }
}
