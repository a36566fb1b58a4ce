package com.scholary.coach.gemini;

/**
 * Client for the Gemini Files and generation APIs.
 *
 * <p>This abstraction keeps HTTP details out of the orchestration logic and lets tests script the
 * backend's behavior.
 */
public interface GeminiClient {

  /**
   * Fetch the metadata and processing state of an uploaded file.
   *
   * @param fileName the file resource name, e.g. {@code files/abc123}
   * @return the file metadata
   * @throws GeminiException if the API answers with a non-2xx status or cannot be reached
   */
  GeminiFile getFile(String fileName);

  /**
   * Run a single generation request.
   *
   * @param model the model name, e.g. {@code gemini-2.5-flash}
   * @param request the request body
   * @return the raw completion
   * @throws GeminiException if the API answers with a non-2xx status or cannot be reached
   */
  GenerateContentResponse generateContent(String model, GenerateContentRequest request);

  /**
   * Delete an uploaded file. Deleting a file that no longer exists succeeds.
   *
   * @param fileName the file resource name
   * @throws GeminiException if the API answers with a status other than 2xx or 404
   */
  void deleteFile(String fileName);
}
