package com.sommerph.zkinbox.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sommerph.zkinbox.model.encryption.EncryptedEnvelope;
import com.sommerph.zkinbox.model.encryption.RecipientKeyPair;
import com.sommerph.zkinbox.model.identity.Identity;
import com.sommerph.zkinbox.model.proof.ProofEnvelope;
import com.sommerph.zkinbox.model.submission.SubmissionIntake;
import com.sommerph.zkinbox.service.encryption.HybridEncryptionService;
import com.sommerph.zkinbox.service.group.InMemoryGroupMembershipService;
import com.sommerph.zkinbox.service.identity.IdentityService;
import com.sommerph.zkinbox.service.nullifier.NullifierService;
import com.sommerph.zkinbox.service.proof.ProofSystem;
import com.sommerph.zkinbox.service.submission.SubmissionPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SubmissionControllerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private IdentityService identityService;

    @Autowired
    private InMemoryGroupMembershipService group;

    @Autowired
    private NullifierService nullifierService;

    @Autowired
    private ProofSystem proofSystem;

    @Autowired
    private HybridEncryptionService encryptionService;

    @Autowired
    private SubmissionPipeline pipeline;

    private RecipientKeyPair recipient;
    private Identity identity;

    @BeforeEach
    void setup() {
        recipient = encryptionService.generateKeyPair();
        identity = identityService.generateIdentity();
        group.addMember(identity.getCommitment());
    }

    private SubmissionIntake intake(String message) {
        byte[] payload = message.getBytes(StandardCharsets.UTF_8);
        long epoch = nullifierService.currentEpoch();
        ProofEnvelope proof = proofSystem.generate(group.proveMembership(identity.getCommitment()), epoch,
                nullifierService.deriveNullifier(identity.getSecret(), epoch), pipeline.signalHash(payload));
        EncryptedEnvelope envelope = encryptionService.encrypt(payload, recipient.getPublicKey());
        return new SubmissionIntake(envelope, proof, System.currentTimeMillis());
    }

    @Test
    void acceptsThenRejectsReplayWithConflict() throws Exception {
        String body = objectMapper.writeValueAsString(intake("integration report"));

        mockMvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.id", notNullValue()));

        mockMvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(
                        "You have already submitted a report in this epoch. Please wait for the next epoch."));
    }

    @Test
    void forgedProofGetsGenericError() throws Exception {
        SubmissionIntake intake = intake("forged");
        intake.getProof().setProtocol("plonk");

        mockMvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(intake)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Submission failed, please retry later."));
    }

    @Test
    void missingFieldsFailValidation() throws Exception {
        mockMvc.perform(post("/api/submissions").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void reportsCurrentEpoch() throws Exception {
        mockMvc.perform(get("/api/submissions/epoch"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.epoch").value(nullifierService.currentEpoch()))
                .andExpect(jsonPath("$.durationSeconds").value(86400));
    }

    @Test
    void validatesRecipientKeys() throws Exception {
        mockMvc.perform(post("/api/submissions/keys/validate").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("publicKey", recipient.getPublicKey()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true));

        mockMvc.perform(post("/api/submissions/keys/validate").contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("publicKey", "not-a-key"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid public key format"));
    }

}
