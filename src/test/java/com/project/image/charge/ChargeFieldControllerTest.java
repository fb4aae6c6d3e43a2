package com.project.image.charge;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.web.servlet.MockMvc;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import javax.imageio.ImageIO;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(properties = "app.upload.dir=target/test-uploads")
@AutoConfigureMockMvc
class ChargeFieldControllerTest {

    @Autowired MockMvc mvc;

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void charge_flow_works() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(24, 16));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("kernelSize", "5")
                        .param("weights", "1.0", "1.0", "1.0", "0.5", "0.3")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attribute("width", 24))
                .andExpect(model().attribute("height", 16))
                .andExpect(model().attribute("view", "charge"))
                .andExpect(model().attributeExists("heatmapPath", "originalPath", "entropy", "maxCharge", "meanCharge"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void curvatureView_withTurbo_works() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "b.png", "image/png", png(10, 10));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("view", "curvature")
                        .param("colormap", "turbo")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("result"))
                .andExpect(model().attribute("view", "curvature"))
                .andExpect(model().attribute("colormap", "turbo"))
                .andExpect(model().attribute("kernelSize", 5));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void evenKernelSize_rerendersFormWithError() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(8, 8));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("kernelSize", "4")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("odd")))
                .andExpect(model().attributeExists("suggestion", "defaultKernelSize"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void wrongWeightCount_rerendersFormWithError() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(8, 8));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("weights", "1.0", "1.0")
                        .with(csrf()))
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("exactly 5")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void nonNumericWeight_rerendersFormNamingTheWeight() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(8, 8));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("weights", "1", "1", "abc", "1", "1")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("Weight #3 is not a number")))
                .andExpect(model().attributeExists("suggestion", "defaultWeights"));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void nonNumericKernelSize_rerendersFormWithError() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(8, 8));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("kernelSize", "x")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("Kernel size is not a whole number")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void kernelSizeAbove99_rerendersFormWithError() throws Exception {
        MockMultipartFile img = new MockMultipartFile("file", "a.png", "image/png", png(8, 8));

        mvc.perform(multipart("/charge")
                        .file(img)
                        .param("kernelSize", "101")
                        .with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("cannot be larger than 99")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void corruptImage_rerendersFormWithError() throws Exception {
        MockMultipartFile img = new MockMultipartFile(
                "file", "a.png", "image/png", new byte[]{(byte) 0x89, 'P', 'N', 'G'}
        );

        mvc.perform(multipart("/charge").file(img).with(csrf()))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("error", containsString("not a valid image")));
    }

    @Test
    @WithMockUser(username = "user", roles = {"USER"})
    void showForm_populatesDefaults() throws Exception {
        mvc.perform(get("/charge"))
                .andExpect(status().isOk())
                .andExpect(view().name("charge"))
                .andExpect(model().attribute("defaultKernelSize", 5))
                .andExpect(model().attributeExists("defaultWeights", "engines", "views", "colormaps"));
    }

    @Test
    void unauthenticated_isRedirectedToLogin() throws Exception {
        mvc.perform(get("/charge"))
                .andExpect(status().is3xxRedirection())
                .andExpect(header().string("Location", containsString("/login")));
    }

    @Test
    void homePage_isPublic() throws Exception {
        mvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(view().name("index"));
    }

    private static byte[] png(int w, int h) throws Exception {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                img.setRGB(x, y, ((x * 10) << 16) | ((y * 15) << 8) | ((x + y) * 5));
            }
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(img, "png", out);
        return out.toByteArray();
    }
}
