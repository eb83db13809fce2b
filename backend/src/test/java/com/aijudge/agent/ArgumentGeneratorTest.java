package com.aijudge.agent;

import com.aijudge.debate.ResponseNormalizer;
import com.aijudge.model.WordBand;
import com.aijudge.provider.CompletionClient;
import com.aijudge.provider.CompletionRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ArgumentGeneratorTest {

    private static final WordBand BAND = new WordBand(250, 350);
    private static final String FULL_ARGUMENT = String.join(" ", Collections.nCopies(70, "The landlord acted unfairly."));
    private static final String SHORT_ARGUMENT = String.join(" ", Collections.nCopies(5, "The landlord acted unfairly."));

    @Mock
    private CompletionClient completionClient;

    private ArgumentGenerator argumentGenerator;

    @BeforeEach
    void setUp() {
        argumentGenerator = new ArgumentGenerator(completionClient, new ResponseNormalizer(), BAND, 2);
    }

    @Test
    void returnsNormalizedTextWhenFirstResponseIsLongEnough() {
        when(completionClient.generate(any())).thenReturn("```\n" + FULL_ARGUMENT + "\n```");

        String argument = argumentGenerator.generate("system", "user prompt", "escalated prompt", 0.8d);

        ArgumentCaptor<CompletionRequest> request = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient).generate(request.capture());
        assertEquals(FULL_ARGUMENT, argument);
        assertEquals("user prompt", request.getValue().prompt());
        assertEquals("system", request.getValue().systemPrompt());
        assertEquals(0.8d, request.getValue().temperature());
        assertEquals(466, request.getValue().maxTokens());
        assertTrue(request.getValue().options().isEmpty());
    }

    @Test
    void shortResponseIsRetriedWithEscalatedPrompt() {
        when(completionClient.generate(any())).thenReturn(SHORT_ARGUMENT, FULL_ARGUMENT);

        String argument = argumentGenerator.generate("system", "user prompt", "escalated prompt", 0.25d);

        ArgumentCaptor<CompletionRequest> requests = ArgumentCaptor.forClass(CompletionRequest.class);
        verify(completionClient, times(2)).generate(requests.capture());
        List<CompletionRequest> sent = requests.getAllValues();
        assertEquals("user prompt", sent.get(0).prompt());
        assertEquals("escalated prompt", sent.get(1).prompt());
        assertEquals(280, ResponseNormalizer.countWords(argument));
    }

    @Test
    void persistentlyShortResponseIsPaddedIntoBand() {
        when(completionClient.generate(any())).thenReturn(SHORT_ARGUMENT);

        String argument = argumentGenerator.generate("system", "user prompt", "escalated prompt", 0.8d);

        verify(completionClient, times(2)).generate(any());
        assertTrue(argument.startsWith(SHORT_ARGUMENT));
        assertTrue(BAND.contains(ResponseNormalizer.countWords(argument)));
    }
}
