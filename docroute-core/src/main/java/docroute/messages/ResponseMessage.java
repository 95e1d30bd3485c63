/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package docroute.messages;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import docroute.coordinate.DocumentClientException;
import docroute.coordinate.StatusCodes;

/**
 * A backend response as handed back by the transport: status, headers and the fully buffered body
 */
public final class ResponseMessage
{
    private final int statusCode;
    private final Headers headers;
    private final byte[] body;

    public ResponseMessage(int statusCode, Headers headers, byte[] body)
    {
        this.statusCode = statusCode;
        this.headers = Objects.requireNonNull(headers);
        this.body = Objects.requireNonNull(body);
    }

    public static ResponseMessage ok(Headers headers, String body)
    {
        return new ResponseMessage(StatusCodes.OK, headers, body.getBytes(StandardCharsets.UTF_8));
    }

    public int statusCode()
    {
        return statusCode;
    }

    public Headers headers()
    {
        return headers;
    }

    public byte[] body()
    {
        return body;
    }

    public boolean isSuccess()
    {
        return StatusCodes.isSuccess(statusCode);
    }

    /**
     * The typed failure for a non-success response, carrying status, substatus, activity id and charge
     */
    public DocumentClientException toException()
    {
        String message = body.length == 0 ? "Request failed with status " + statusCode
                                          : new String(body, StandardCharsets.UTF_8);
        return DocumentClientException.create(message, statusCode, headers.subStatusCode(),
                                              headers.activityId(), headers.requestCharge(), headers);
    }

    /**
     * Throws the typed failure unless the response succeeded
     */
    public ResponseMessage ensureSuccessStatusCode()
    {
        if (!isSuccess())
            throw toException();
        return this;
    }

    @Override
    public String toString()
    {
        return "ResponseMessage{" + statusCode + ", " + headers + ", " + body.length + " bytes}";
    }
}
