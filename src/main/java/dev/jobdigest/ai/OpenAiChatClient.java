package dev.jobdigest.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.jobdigest.config.LlmProperties;
import dev.jobdigest.entity.ResumeProfile;
import dev.jobdigest.model.EmailClassification;
import dev.jobdigest.model.EmailPreview;
import dev.jobdigest.model.JobPostingDraft;
import dev.jobdigest.model.ResumeDocument;
import dev.jobdigest.model.Seniority;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM capabilities backed by an OpenAI-compatible chat completions API.
 * Every prompt asks for JSON (or a bare number for scoring); markdown fences around the
 * answer are tolerated.
 */
@Slf4j
@Service
public class OpenAiChatClient implements EmailClassifier, JobExtractor, RelevanceScorer, ResumeAnalyzer {

  private static final String CHAT_PATH = "/chat/completions";
  private static final Pattern NUMBER = Pattern.compile("(\\d*\\.\\d+|\\d+)\\s*(%)?");

  private final WebClient webClient;
  private final LlmProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public OpenAiChatClient(LlmProperties properties, ObjectMapper objectMapper, Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.webClient = WebClient.builder()
        .baseUrl(properties.getBaseUrl())
        .defaultHeader("Authorization", "Bearer " + properties.getApiKey())
        .defaultHeader("Content-Type", "application/json")
        .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
        .build();

    if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
      log.warn("LLM API key is missing! Classification, extraction and scoring will fail.");
    } else {
      log.info("LLM client enabled with model {} at {}", properties.getModel(), properties.getBaseUrl());
    }
  }

  @Override
  public Mono<List<EmailClassification>> classifyBatch(List<EmailPreview> emails) {
    if (emails.isEmpty()) {
      return Mono.just(List.of());
    }

    StringBuilder prompt = new StringBuilder();
    prompt.append("Analyze these emails and determine which ones contain job opportunities or career-related content:\n\n");
    for (int i = 0; i < emails.size(); i++) {
      EmailPreview email = emails.get(i);
      prompt.append(String.format("Email %d (ID: %s):%nFrom: %s%nSubject: %s%nBody Preview: %s...%n%n",
          i + 1, email.id(), email.from(), email.subject(), email.bodyPreview()));
    }
    prompt.append("""
        For each email, determine if it contains job listings, job alerts, recruitment emails
        or other professional opportunities.

        Return a JSON array with this exact structure:
        [{"id": "email_id", "isJobRelated": true, "confidence": 0.0}]

        Use high confidence (>0.8) only for clear job opportunities.
        Use medium confidence (0.5-0.8) for career-related but not direct job posts.
        Use low confidence (<0.5) for non-job emails.
        """);

    return complete("You are an expert at classifying emails for job content. Return only valid JSON array.",
        prompt.toString())
        .map(content -> parse(content, new TypeReference<List<ClassificationDto>>() {
        }))
        .map(results -> results.stream()
            .filter(result -> result.id() != null)
            .map(result -> new EmailClassification(result.id(), Boolean.TRUE.equals(result.jobRelated()),
                clamp(result.confidence())))
            .toList())
        .doOnNext(results -> log.debug("Classified batch of {} emails, {} results", emails.size(), results.size()));
  }

  @Override
  public Mono<List<JobPostingDraft>> extractJobs(String body, String subject, String from) {
    String prompt = String.format("""
        Extract job listings from this email content. This email is from a job platform like LinkedIn, JobStreet, etc.

        Email From: %s
        Email Subject: %s
        Email Content:
        %s

        Return a JSON array of job listings with this structure:
        [{"title": "Job Title", "company": "Company Name", "location": "Location", "isRemote": false,
          "description": "Job description", "requirements": ["requirement1"], "applyUrl": "https://...",
          "salary": null, "postedDate": "YYYY-MM-DD", "source": "platform name"}]

        Rules:
        - Extract ALL job listings from the email
        - If location mentions "remote", "work from home" or "WFH", set isRemote to true
        - Extract apply URLs carefully
        - If salary is not mentioned, set it to null
        - Return an empty array if no jobs are found
        """, from, subject, truncate(body, properties.getMaxBodyChars()));

    return complete("You are an expert at extracting structured job data from emails. Return only valid JSON array.",
        prompt)
        .map(content -> parse(content, new TypeReference<List<ExtractedJobDto>>() {
        }))
        .map(jobs -> jobs.stream().map(job -> toDraft(job, from)).toList());
  }

  @Override
  public Mono<Double> score(JobPostingDraft draft, ResumeProfile profile) {
    String prompt = String.format("""
        Calculate how relevant this job is for this candidate based on their resume analysis.

        Job Details:
        - Title: %s
        - Company: %s
        - Location: %s
        - Remote: %s
        - Description: %s
        - Requirements: %s

        Candidate Profile:
        - Skills: %s
        - Experience: %s
        - Preferred Roles: %s
        - Seniority: %s

        Return a relevance score between 0.0 and 1.0 where:
        - 1.0 = Perfect match (exact skills, role, seniority)
        - 0.8-0.9 = Excellent match (most skills align)
        - 0.6-0.7 = Good match (some skills align)
        - 0.4-0.5 = Fair match (limited alignment)
        - 0.0-0.3 = Poor match (little to no alignment)

        Return only the numeric score (e.g., 0.85)
        """,
        draft.getTitle(), draft.getCompany(), draft.getLocation(), draft.isRemote(),
        truncate(draft.getDescription(), 2000),
        draft.getRequirements() != null ? String.join(", ", draft.getRequirements()) : "",
        String.join(", ", profile.getSkills()), String.join(", ", profile.getExperience()),
        String.join(", ", profile.getPreferredRoles()), profile.getSeniority());

    return complete("You are an expert job matching system. Return only a numeric relevance score.", prompt)
        .map(this::parseScore);
  }

  @Override
  public Mono<ResumeProfile> analyze(ResumeDocument document) {
    String prompt = String.format("""
        Analyze this resume and extract key information for job matching:

        Resume Content:
        %s

        Return a JSON object with the following structure:
        {"skills": ["skill1"], "experience": ["experience1"], "preferredRoles": ["role1"],
         "seniority": "junior|mid|senior|lead|principal"}

        Focus on technical skills, years of experience and seniority level, preferred job titles
        and key experience highlights.
        """, document.text());

    return complete("You are an expert at analyzing resumes. Return only valid JSON.", prompt)
        .map(content -> parse(content, new TypeReference<ResumeAnalysisDto>() {
        }))
        .map(analysis -> ResumeProfile.builder()
            .skills(distinct(analysis.skills()))
            .experience(analysis.experience() != null ? new ArrayList<>(analysis.experience()) : new ArrayList<>())
            .preferredRoles(distinct(analysis.preferredRoles()))
            .seniority(Seniority.fromLabel(analysis.seniority()))
            .analyzedAt(Instant.now(clock))
            .build())
        .doOnNext(profile -> log.info("Resume {} analysed: {} skills, seniority {}",
            document.name(), profile.getSkills().size(), profile.getSeniority()));
  }

  /**
   * One chat completion round trip, retried on rate limits and server errors.
   */
  private Mono<String> complete(String system, String prompt) {
    ChatRequest request = new ChatRequest(properties.getModel(),
        List.of(new ChatRequest.Message("system", system), new ChatRequest.Message("user", prompt)),
        properties.getTemperature());

    return webClient.post()
        .uri(CHAT_PATH)
        .bodyValue(request)
        .retrieve()
        .bodyToMono(ChatResponse.class)
        .timeout(properties.getTimeout())
        .retryWhen(Retry.backoff(properties.getMaxRetries(), properties.getRetryBackoff())
            .filter(this::isRetryableError)
            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
        .flatMap(response -> {
          String content = extractContent(response);
          if (content == null || content.isBlank()) {
            return Mono.error(new LlmResponseException("Empty completion from " + properties.getModel()));
          }
          return Mono.just(content);
        });
  }

  <T> T parse(String content, TypeReference<T> type) {
    String clean = content.replaceAll("```json\\n?", "").replace("```", "").trim();
    try {
      return objectMapper.readValue(clean, type);
    } catch (JsonProcessingException e) {
      log.warn("Unparseable LLM answer: {}", truncate(clean, 200));
      throw new LlmResponseException("LLM answer is not valid JSON: " + e.getOriginalMessage(), e);
    }
  }

  double parseScore(String content) {
    Matcher matcher = NUMBER.matcher(content);
    if (!matcher.find()) {
      log.warn("No score in LLM answer '{}', using 0", truncate(content, 100));
      return 0.0;
    }
    double value = Double.parseDouble(matcher.group(1));
    // "85" and "85%" both mean 0.85
    if (matcher.group(2) != null || value > 1.0) {
      value = value / 100.0;
    }
    return clamp(value);
  }

  private JobPostingDraft toDraft(ExtractedJobDto job, String from) {
    return JobPostingDraft.builder()
        .title(job.title())
        .company(job.company())
        .location(job.location())
        .remote(Boolean.TRUE.equals(job.remote()) || mentionsRemote(job.location()))
        .description(job.description())
        .requirements(job.requirements() != null ? new ArrayList<>(job.requirements()) : new ArrayList<>())
        .applyUrl(job.applyUrl())
        .salary(job.salary())
        .postedDate(parseDate(job.postedDate()))
        .source(job.source() != null && !job.source().isBlank() ? job.source() : determineSource(from))
        .build();
  }

  static String determineSource(String from) {
    String sender = from != null ? from.toLowerCase(Locale.ROOT) : "";
    if (sender.contains("linkedin")) return "LinkedIn";
    if (sender.contains("jobstreet")) return "JobStreet";
    if (sender.contains("indeed")) return "Indeed";
    if (sender.contains("glassdoor")) return "Glassdoor";
    return "Unknown";
  }

  private boolean mentionsRemote(String location) {
    if (location == null) {
      return false;
    }
    String lower = location.toLowerCase(Locale.ROOT);
    return lower.contains("remote") || lower.contains("work from home") || lower.contains("wfh");
  }

  private LocalDate parseDate(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      log.debug("Ignoring posted date '{}'", value);
      return null;
    }
  }

  private List<String> distinct(List<String> values) {
    return values != null ? new ArrayList<>(new LinkedHashSet<>(values)) : new ArrayList<>();
  }

  private String extractContent(ChatResponse response) {
    if (response != null && response.choices() != null && !response.choices().isEmpty()
        && response.choices().get(0).message() != null) {
      return response.choices().get(0).message().content();
    }
    return null;
  }

  private boolean isRetryableError(Throwable e) {
    if (e instanceof WebClientResponseException responseException) {
      int status = responseException.getStatusCode().value();
      return status == 429 || status >= 500;
    }
    return false;
  }

  private static double clamp(Double value) {
    if (value == null || value.isNaN()) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, value));
  }

  private static String truncate(String value, int max) {
    if (value == null) {
      return "";
    }
    return value.length() > max ? value.substring(0, max) + "..." : value;
  }

  // DTOs
  record ChatRequest(String model, List<Message> messages, double temperature) {
    record Message(String role, String content) {
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChatResponse(List<Choice> choices) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Choice(Message message) {
      @JsonIgnoreProperties(ignoreUnknown = true)
      record Message(String content) {
      }
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ClassificationDto(String id, @JsonProperty("isJobRelated") Boolean jobRelated, Double confidence) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ExtractedJobDto(String title, String company, String location, @JsonProperty("isRemote") Boolean remote,
                         String description, List<String> requirements, String applyUrl, String salary,
                         String postedDate, String source) {
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ResumeAnalysisDto(List<String> skills, List<String> experience, List<String> preferredRoles,
                           String seniority) {
  }
}
